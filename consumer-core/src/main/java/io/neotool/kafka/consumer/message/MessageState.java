package io.neotool.kafka.consumer.message;

/** Lifecycle of a single message inside the engine. */
public enum MessageState {
  /** Handed over by the poll loop, waiting for its partition permit. */
  RECEIVED,
  /** Holding the partition permit, {@code process} is running or about to run. */
  PROCESSING,
  /** Process returned normally. */
  SUCCEEDED,
  /** Failed with a retryable error, waiting for the retry delay. */
  RETRY_SCHEDULED,
  /** Failed terminally, handed to the DLQ publisher. */
  DLQ_PENDING,
  /** Resolved and recorded for commit. Terminal. */
  COMMITTED,
  /** DLQ publish failed with fallback disabled; never committed. Terminal. */
  BLOCKED,
  /** Dropped by shutdown or revocation before resolution; will be redelivered. Terminal. */
  ABANDONED;

  public boolean isTerminal() {
    return this == COMMITTED || this == BLOCKED || this == ABANDONED;
  }
}
