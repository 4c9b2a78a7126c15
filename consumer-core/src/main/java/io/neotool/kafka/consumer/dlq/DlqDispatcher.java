package io.neotool.kafka.consumer.dlq;

import com.uber.m3.tally.Scope;
import io.neotool.kafka.consumer.common.CoreInfra;
import io.neotool.kafka.consumer.common.StructuredLogging;
import io.neotool.kafka.consumer.common.StructuredTags;
import io.neotool.kafka.consumer.config.ConsumerConfiguration;
import io.neotool.kafka.consumer.metrics.ConsumerMetrics;
import io.neotool.kafka.instrumentation.Instrumentation;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.function.BooleanSupplier;
import javax.annotation.Nullable;
import net.jodah.failsafe.Failsafe;
import net.jodah.failsafe.Fallback;
import net.jodah.failsafe.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DlqDispatcher publishes envelopes with bounded retries and decides what happens when publishing
 * ultimately fails.
 *
 * <p>A Failsafe {@link RetryPolicy} retries the publisher up to {@code dlqMaxRetries} times with
 * the consumer's backoff. A {@link Fallback} wrapped around it maps the final failure to either the
 * fallback hook or {@link DlqOutcome#FAILED}. Once the abort signal is raised no further attempt is
 * made and the outcome is {@link DlqOutcome#ABORTED}.
 *
 * <p>Runs synchronously on the calling worker thread.
 */
public class DlqDispatcher<V> {
  private static final Logger LOGGER = LoggerFactory.getLogger(DlqDispatcher.class);

  private final DlqPublisher<V> publisher;
  private final DlqFallback<V> fallback;
  private final boolean fallbackEnabled;
  private final int maxRetries;
  private final Duration initialDelay;
  private final Duration maxDelay;
  private final double multiplier;
  private final ConsumerMetrics metrics;
  private final BooleanSupplier aborted;
  private final CoreInfra infra;

  public DlqDispatcher(
      DlqPublisher<V> publisher,
      DlqFallback<V> fallback,
      ConsumerConfiguration config,
      ConsumerMetrics metrics,
      BooleanSupplier aborted,
      CoreInfra infra) {
    this.publisher = publisher;
    this.fallback = fallback;
    this.fallbackEnabled = config.isEnableDlqFallback();
    this.maxRetries = config.getDlqMaxRetries();
    this.initialDelay = Duration.ofMillis(config.getInitialRetryDelayMs());
    this.maxDelay = Duration.ofMillis(config.getMaxRetryDelayMs());
    this.multiplier = config.getRetryBackoffMultiplier();
    this.metrics = metrics;
    this.aborted = aborted;
    this.infra = infra;
  }

  /**
   * Publishes the envelope, retrying on failure.
   *
   * @return {@link DlqOutcome#PUBLISHED} or {@link DlqOutcome#FALLBACK} when the message may be
   *     committed, {@link DlqOutcome#FAILED} or {@link DlqOutcome#ABORTED} otherwise.
   */
  public DlqOutcome dispatch(DlqEnvelope<V> envelope) {
    final Scope scope =
        infra
            .scope()
            .tagged(
                StructuredTags.builder()
                    .setKafkaTopic(envelope.getTopic())
                    .setKafkaPartition(envelope.getPartition())
                    .build());
    Fallback<DlqOutcome> onExhausted =
        Fallback.<DlqOutcome>of(
                e -> {
                  return onPublishFailed(scope, envelope, e.getLastFailure());
                })
            .handleResult(DlqOutcome.FAILED);
    DlqOutcome outcome;
    try {
      outcome =
          Failsafe.with(onExhausted, retryPolicy(scope, envelope))
              .get(() -> publishOnce(scope, envelope));
    } catch (RuntimeException e) {
      // interrupted between attempts by a forced shutdown, or the fallback hook itself failed.
      LOGGER.error(
          MetricNames.DISPATCH_FAILURE,
          StructuredLogging.kafkaTopic(envelope.getTopic()),
          StructuredLogging.kafkaPartition(envelope.getPartition()),
          StructuredLogging.kafkaOffset(envelope.getOffset()),
          e);
      scope.counter(MetricNames.DISPATCH_FAILURE).inc(1);
      outcome = aborted.getAsBoolean() ? DlqOutcome.ABORTED : DlqOutcome.FAILED;
    }
    if (outcome == DlqOutcome.PUBLISHED) {
      metrics.incrementDlq();
      metrics.incrementError("dlq");
    }
    return outcome;
  }

  private DlqOutcome publishOnce(Scope scope, DlqEnvelope<V> envelope) throws Exception {
    boolean published =
        Instrumentation.instrument.withException(
            LOGGER,
            scope,
            infra.tracer(),
            () -> publisher.publish(envelope),
            r -> r,
            MetricNames.PUBLISH);
    return published ? DlqOutcome.PUBLISHED : DlqOutcome.FAILED;
  }

  private DlqOutcome onPublishFailed(
      Scope scope, DlqEnvelope<V> envelope, @Nullable Throwable lastFailure) {
    if (aborted.getAsBoolean()) {
      return DlqOutcome.ABORTED;
    }
    if (!fallbackEnabled) {
      return DlqOutcome.FAILED;
    }
    scope.counter(MetricNames.FALLBACK).inc(1);
    fallback.handle(envelope, lastFailure);
    return DlqOutcome.FALLBACK;
  }

  private RetryPolicy<DlqOutcome> retryPolicy(Scope scope, DlqEnvelope<V> envelope) {
    RetryPolicy<DlqOutcome> retryPolicy =
        new RetryPolicy<DlqOutcome>()
            .handleResult(DlqOutcome.FAILED)
            .withMaxRetries(maxRetries)
            .abortIf((r, t) -> aborted.getAsBoolean())
            .onFailedAttempt(e -> metrics.incrementDlqPublishFailure())
            .onRetry(
                e -> {
                  scope.counter(MetricNames.RETRYER_RETRY).inc(1);
                  LOGGER.warn(
                      MetricNames.RETRYER_RETRY,
                      StructuredLogging.kafkaTopic(envelope.getTopic()),
                      StructuredLogging.kafkaPartition(envelope.getPartition()),
                      StructuredLogging.kafkaOffset(envelope.getOffset()),
                      StructuredLogging.attempt(e.getAttemptCount()),
                      e.getLastFailure());
                })
            .onRetriesExceeded(
                e -> {
                  scope.counter(MetricNames.RETRYER_RETRIES_EXCEEDED).inc(1);
                  LOGGER.error(
                      MetricNames.RETRYER_RETRIES_EXCEEDED,
                      StructuredLogging.kafkaTopic(envelope.getTopic()),
                      StructuredLogging.kafkaPartition(envelope.getPartition()),
                      StructuredLogging.kafkaOffset(envelope.getOffset()),
                      e.getFailure());
                })
            .onAbort(
                e -> {
                  scope.counter(MetricNames.RETRYER_ABORT).inc(1);
                  LOGGER.warn(
                      MetricNames.RETRYER_ABORT,
                      StructuredLogging.kafkaTopic(envelope.getTopic()),
                      StructuredLogging.kafkaPartition(envelope.getPartition()),
                      StructuredLogging.kafkaOffset(envelope.getOffset()));
                });
    if (initialDelay.toMillis() > 0
        && maxDelay.compareTo(initialDelay) > 0
        && multiplier > 1.0) {
      retryPolicy.withBackoff(
          initialDelay.toMillis(), maxDelay.toMillis(), ChronoUnit.MILLIS, multiplier);
    } else if (initialDelay.toMillis() > 0) {
      retryPolicy.withDelay(initialDelay);
    }
    return retryPolicy;
  }

  private static class MetricNames {
    static final String PUBLISH = "consumer.dlq.publish";
    static final String FALLBACK = "consumer.dlq.fallback";
    static final String DISPATCH_FAILURE = "consumer.dlq.dispatch.failure";
    static final String RETRYER_RETRY = "consumer.dlq.retryer.retry";
    static final String RETRYER_RETRIES_EXCEEDED = "consumer.dlq.retryer.exceeded";
    static final String RETRYER_ABORT = "consumer.dlq.retryer.abort";
  }
}
