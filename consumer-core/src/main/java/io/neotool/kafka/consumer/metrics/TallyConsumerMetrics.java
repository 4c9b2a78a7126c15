package io.neotool.kafka.consumer.metrics;

import com.google.common.collect.ImmutableMap;
import com.uber.m3.tally.Scope;

/**
 * ConsumerMetrics on a tally scope. Metric names are "$prefix.processed", "$prefix.dlq.count",
 * "$prefix.error.count{type}", "$prefix.retry.count" and "$prefix.dlq.publish.failure".
 */
public class TallyConsumerMetrics implements ConsumerMetrics {
  private static final String TYPE_TAG = "type";

  private final Scope scope;
  private final String processed;
  private final String dlqCount;
  private final String errorCount;
  private final String retryCount;
  private final String dlqPublishFailure;

  public TallyConsumerMetrics(Scope scope, String prefix) {
    this.scope = scope;
    this.processed = prefix + MetricNames.PROCESSED;
    this.dlqCount = prefix + MetricNames.DLQ_COUNT;
    this.errorCount = prefix + MetricNames.ERROR_COUNT;
    this.retryCount = prefix + MetricNames.RETRY_COUNT;
    this.dlqPublishFailure = prefix + MetricNames.DLQ_PUBLISH_FAILURE;
  }

  @Override
  public void incrementProcessed() {
    scope.counter(processed).inc(1);
  }

  @Override
  public void incrementDlq() {
    scope.counter(dlqCount).inc(1);
  }

  @Override
  public void incrementError(String type) {
    scope.tagged(ImmutableMap.of(TYPE_TAG, type)).counter(errorCount).inc(1);
  }

  @Override
  public void incrementRetry() {
    scope.counter(retryCount).inc(1);
  }

  @Override
  public void incrementDlqPublishFailure() {
    scope.counter(dlqPublishFailure).inc(1);
  }

  private static class MetricNames {
    static final String PROCESSED = ".processed";
    static final String DLQ_COUNT = ".dlq.count";
    static final String ERROR_COUNT = ".error.count";
    static final String RETRY_COUNT = ".retry.count";
    static final String DLQ_PUBLISH_FAILURE = ".dlq.publish.failure";
  }
}
