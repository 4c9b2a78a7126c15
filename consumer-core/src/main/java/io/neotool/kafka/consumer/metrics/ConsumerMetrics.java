package io.neotool.kafka.consumer.metrics;

/**
 * Business level counters emitted by the engine. The engine emits, the application owns the
 * backend.
 */
public interface ConsumerMetrics {

  /** A message was processed successfully. */
  void incrementProcessed();

  /** A message was published to the DLQ. */
  void incrementDlq();

  /**
   * A message failed.
   *
   * @param type short error class such as "validation", "processing", "dlq" or "unexpected".
   */
  void incrementError(String type);

  /** A retry was scheduled. */
  void incrementRetry();

  /** One DLQ publish attempt failed. */
  void incrementDlqPublishFailure();

  ConsumerMetrics NOOP =
      new ConsumerMetrics() {
        @Override
        public void incrementProcessed() {}

        @Override
        public void incrementDlq() {}

        @Override
        public void incrementError(String type) {}

        @Override
        public void incrementRetry() {}

        @Override
        public void incrementDlqPublishFailure() {}
      };
}
