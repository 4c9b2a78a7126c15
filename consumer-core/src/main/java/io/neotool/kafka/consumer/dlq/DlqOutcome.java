package io.neotool.kafka.consumer.dlq;

/** Result of handing an envelope to the {@link DlqDispatcher}. */
public enum DlqOutcome {
  // the publisher accepted the envelope
  PUBLISHED,
  // publishing failed and the fallback hook took the envelope
  FALLBACK,
  // publishing failed and no fallback is enabled
  FAILED,
  // the consumer was force stopped before the envelope was published
  ABORTED;

  /** @return true if the offset of the message may be committed. */
  public boolean isResolved() {
    return this == PUBLISHED || this == FALLBACK;
  }
}
