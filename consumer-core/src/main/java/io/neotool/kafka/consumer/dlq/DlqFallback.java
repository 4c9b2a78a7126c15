package io.neotool.kafka.consumer.dlq;

import javax.annotation.Nullable;

/** Last resort for an envelope that could not be published. The message is dropped afterwards. */
@FunctionalInterface
public interface DlqFallback<V> {

  /**
   * @param envelope the envelope that was not published.
   * @param lastFailure exception of the last attempt, null if the publisher returned false.
   */
  void handle(DlqEnvelope<V> envelope, @Nullable Throwable lastFailure);
}
