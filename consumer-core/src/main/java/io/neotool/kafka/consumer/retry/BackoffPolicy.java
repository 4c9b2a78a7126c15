package io.neotool.kafka.consumer.retry;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.neotool.kafka.consumer.config.ConsumerConfiguration;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with a cap and optional jitter.
 *
 * <p>delay(n) = min(initialDelayMs * multiplier^(n-1), maxDelayMs), where n is the retry number
 * starting at 1. Jitter adds up to {@code jitterFactor * delay(n)}, still capped.
 */
public final class BackoffPolicy {
  private final long initialDelayMs;
  private final long maxDelayMs;
  private final double multiplier;
  private final double jitterFactor;
  private final DoubleSupplier random;

  public BackoffPolicy(long initialDelayMs, long maxDelayMs, double multiplier) {
    this(
        initialDelayMs,
        maxDelayMs,
        multiplier,
        0.0,
        () -> ThreadLocalRandom.current().nextDouble());
  }

  @VisibleForTesting
  BackoffPolicy(
      long initialDelayMs,
      long maxDelayMs,
      double multiplier,
      double jitterFactor,
      DoubleSupplier random) {
    Preconditions.checkArgument(initialDelayMs >= 0, "initialDelayMs must be >= 0");
    Preconditions.checkArgument(
        maxDelayMs >= initialDelayMs, "maxDelayMs must be >= initialDelayMs");
    Preconditions.checkArgument(multiplier >= 1.0, "multiplier must be >= 1.0");
    Preconditions.checkArgument(
        jitterFactor >= 0.0 && jitterFactor <= 1.0, "jitterFactor must be within [0, 1]");
    this.initialDelayMs = initialDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.multiplier = multiplier;
    this.jitterFactor = jitterFactor;
    this.random = random;
  }

  public static BackoffPolicy of(ConsumerConfiguration config) {
    return new BackoffPolicy(
        config.getInitialRetryDelayMs(),
        config.getMaxRetryDelayMs(),
        config.getRetryBackoffMultiplier(),
        config.getRetryJitterFactor(),
        () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * @param retryNumber 1 for the first retry.
   * @return delay before that retry.
   */
  public Duration delay(int retryNumber) {
    Preconditions.checkArgument(retryNumber >= 1, "retryNumber must be >= 1");
    double base = Math.min(initialDelayMs * Math.pow(multiplier, retryNumber - 1), maxDelayMs);
    double jittered = base + base * jitterFactor * random.getAsDouble();
    return Duration.ofMillis((long) Math.min(jittered, maxDelayMs));
  }

  public long getInitialDelayMs() {
    return initialDelayMs;
  }

  public long getMaxDelayMs() {
    return maxDelayMs;
  }

  public double getMultiplier() {
    return multiplier;
  }
}
