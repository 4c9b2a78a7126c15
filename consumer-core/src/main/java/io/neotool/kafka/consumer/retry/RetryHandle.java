package io.neotool.kafka.consumer.retry;

/** Cancellation token for a scheduled retry. */
public interface RetryHandle {

  /**
   * Cancels the retry if it has not fired yet.
   *
   * @return true if this call cancelled it.
   */
  boolean cancel();

  boolean isCancelled();

  /** @return true once the retry task has been handed off for execution. */
  boolean isFired();

  /** @return nanos of the scheduler ticker at which the retry becomes due. */
  long dueAtNanos();
}
