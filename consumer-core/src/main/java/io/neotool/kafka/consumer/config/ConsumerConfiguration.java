package io.neotool.kafka.consumer.config;

import com.google.common.base.Preconditions;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Retry, DLQ, commit and shutdown settings for the sequenced consumer. */
@ConfigurationProperties("consumer")
public class ConsumerConfiguration {
  // Number of retries after the first attempt for retryable processing failures.
  // Process is invoked at most 1 + maxRetries times per message.
  private int maxRetries = 3;
  // Delay before the first retry.
  private long initialRetryDelayMs = 1000;
  // Upper bound for any retry delay, including DLQ publish retries.
  private long maxRetryDelayMs = 30000;
  // delay(n) = min(initialRetryDelayMs * retryBackoffMultiplier^(n-1), maxRetryDelayMs)
  private double retryBackoffMultiplier = 2.0;
  // Random jitter added on top of the backoff delay, as a fraction of it. 0 disables jitter.
  private double retryJitterFactor = 0.0;
  // Timeout passed to commitSync.
  private long commitTimeoutSeconds = 5;
  // When the DLQ publish ultimately fails: true runs the fallback hook and commits the offset,
  // false blocks the partition without committing so the message is redelivered.
  private boolean enableDlqFallback = false;
  // Number of retries after the first DLQ publish attempt.
  private int dlqMaxRetries = 3;
  // How long a single DLQ publish waits for the broker acknowledgement.
  private long dlqPublishTimeoutMs = 5000;
  // How long shutdown waits for in-flight processing before cancelling it.
  private long shutdownTimeoutSeconds = 30;
  // Worker threads that run processing off the poll thread.
  private int threadPoolSize = 8;
  // Bounded queue in front of the worker threads. A full queue rejects the submission
  // and the message is rescheduled as a retry without consuming an attempt.
  private int maxQueuedTasks = 1000;
  // A partition is paused on the broker once this many messages wait behind its in-flight
  // message and resumed once the backlog drains.
  private int maxQueuedMessagesPerPartition = 100;
  // How often the poll loop flushes resolved offsets.
  private long offsetCommitIntervalMs = 1000;
  // Kafka poll timeout.
  private long pollTimeoutMs = 100;

  /**
   * Validates the configuration.
   *
   * @return this configuration.
   * @throws IllegalArgumentException if a value is out of range.
   */
  public ConsumerConfiguration validate() {
    Preconditions.checkArgument(maxRetries >= 0, "maxRetries must be >= 0");
    Preconditions.checkArgument(initialRetryDelayMs >= 0, "initialRetryDelayMs must be >= 0");
    Preconditions.checkArgument(
        maxRetryDelayMs >= initialRetryDelayMs, "maxRetryDelayMs must be >= initialRetryDelayMs");
    Preconditions.checkArgument(
        retryBackoffMultiplier >= 1.0, "retryBackoffMultiplier must be >= 1.0");
    Preconditions.checkArgument(
        retryJitterFactor >= 0.0 && retryJitterFactor <= 1.0,
        "retryJitterFactor must be within [0, 1]");
    Preconditions.checkArgument(commitTimeoutSeconds > 0, "commitTimeoutSeconds must be > 0");
    Preconditions.checkArgument(dlqMaxRetries >= 0, "dlqMaxRetries must be >= 0");
    Preconditions.checkArgument(dlqPublishTimeoutMs > 0, "dlqPublishTimeoutMs must be > 0");
    Preconditions.checkArgument(shutdownTimeoutSeconds >= 0, "shutdownTimeoutSeconds must be >= 0");
    Preconditions.checkArgument(threadPoolSize > 0, "threadPoolSize must be > 0");
    Preconditions.checkArgument(maxQueuedTasks > 0, "maxQueuedTasks must be > 0");
    Preconditions.checkArgument(
        maxQueuedMessagesPerPartition > 0, "maxQueuedMessagesPerPartition must be > 0");
    Preconditions.checkArgument(offsetCommitIntervalMs >= 0, "offsetCommitIntervalMs must be >= 0");
    Preconditions.checkArgument(pollTimeoutMs > 0, "pollTimeoutMs must be > 0");
    return this;
  }

  public Duration getCommitTimeout() {
    return Duration.ofSeconds(commitTimeoutSeconds);
  }

  public Duration getShutdownTimeout() {
    return Duration.ofSeconds(shutdownTimeoutSeconds);
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
  }

  public long getInitialRetryDelayMs() {
    return initialRetryDelayMs;
  }

  public void setInitialRetryDelayMs(long initialRetryDelayMs) {
    this.initialRetryDelayMs = initialRetryDelayMs;
  }

  public long getMaxRetryDelayMs() {
    return maxRetryDelayMs;
  }

  public void setMaxRetryDelayMs(long maxRetryDelayMs) {
    this.maxRetryDelayMs = maxRetryDelayMs;
  }

  public double getRetryBackoffMultiplier() {
    return retryBackoffMultiplier;
  }

  public void setRetryBackoffMultiplier(double retryBackoffMultiplier) {
    this.retryBackoffMultiplier = retryBackoffMultiplier;
  }

  public double getRetryJitterFactor() {
    return retryJitterFactor;
  }

  public void setRetryJitterFactor(double retryJitterFactor) {
    this.retryJitterFactor = retryJitterFactor;
  }

  public long getCommitTimeoutSeconds() {
    return commitTimeoutSeconds;
  }

  public void setCommitTimeoutSeconds(long commitTimeoutSeconds) {
    this.commitTimeoutSeconds = commitTimeoutSeconds;
  }

  public boolean isEnableDlqFallback() {
    return enableDlqFallback;
  }

  public void setEnableDlqFallback(boolean enableDlqFallback) {
    this.enableDlqFallback = enableDlqFallback;
  }

  public int getDlqMaxRetries() {
    return dlqMaxRetries;
  }

  public void setDlqMaxRetries(int dlqMaxRetries) {
    this.dlqMaxRetries = dlqMaxRetries;
  }

  public long getDlqPublishTimeoutMs() {
    return dlqPublishTimeoutMs;
  }

  public void setDlqPublishTimeoutMs(long dlqPublishTimeoutMs) {
    this.dlqPublishTimeoutMs = dlqPublishTimeoutMs;
  }

  public long getShutdownTimeoutSeconds() {
    return shutdownTimeoutSeconds;
  }

  public void setShutdownTimeoutSeconds(long shutdownTimeoutSeconds) {
    this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
  }

  public int getThreadPoolSize() {
    return threadPoolSize;
  }

  public void setThreadPoolSize(int threadPoolSize) {
    this.threadPoolSize = threadPoolSize;
  }

  public int getMaxQueuedTasks() {
    return maxQueuedTasks;
  }

  public void setMaxQueuedTasks(int maxQueuedTasks) {
    this.maxQueuedTasks = maxQueuedTasks;
  }

  public int getMaxQueuedMessagesPerPartition() {
    return maxQueuedMessagesPerPartition;
  }

  public void setMaxQueuedMessagesPerPartition(int maxQueuedMessagesPerPartition) {
    this.maxQueuedMessagesPerPartition = maxQueuedMessagesPerPartition;
  }

  public long getOffsetCommitIntervalMs() {
    return offsetCommitIntervalMs;
  }

  public void setOffsetCommitIntervalMs(long offsetCommitIntervalMs) {
    this.offsetCommitIntervalMs = offsetCommitIntervalMs;
  }

  public long getPollTimeoutMs() {
    return pollTimeoutMs;
  }

  public void setPollTimeoutMs(long pollTimeoutMs) {
    this.pollTimeoutMs = pollTimeoutMs;
  }
}
