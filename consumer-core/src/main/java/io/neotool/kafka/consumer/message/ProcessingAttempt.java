package io.neotool.kafka.consumer.message;

import com.google.common.base.MoreObjects;
import java.time.Instant;

/**
 * ProcessingAttempt tracks one message across its retries.
 *
 * <p>The thread owning the partition permit drives the attempt. A forced shutdown may abandon it
 * concurrently, so state changes are synchronized.
 */
public final class ProcessingAttempt<V> {
  private final InboundMessage<V> message;
  private final Instant firstSeenAt;
  // assignment generation of the partition when the message was received, 0 if not tracked
  private final long assignmentGeneration;
  private volatile int attemptNumber = 1;
  private volatile MessageState state = MessageState.RECEIVED;

  public ProcessingAttempt(InboundMessage<V> message, Instant firstSeenAt) {
    this(message, firstSeenAt, 0L);
  }

  public ProcessingAttempt(
      InboundMessage<V> message, Instant firstSeenAt, long assignmentGeneration) {
    this.message = message;
    this.firstSeenAt = firstSeenAt;
    this.assignmentGeneration = assignmentGeneration;
  }

  public InboundMessage<V> getMessage() {
    return message;
  }

  public Instant getFirstSeenAt() {
    return firstSeenAt;
  }

  public long getAssignmentGeneration() {
    return assignmentGeneration;
  }

  /** @return 1 for the first invocation of process, 2 for the first retry, and so on. */
  public int getAttemptNumber() {
    return attemptNumber;
  }

  /** @return number of retries already performed. */
  public int getRetryCount() {
    return attemptNumber - 1;
  }

  public void incrementAttempt() {
    attemptNumber++;
  }

  public MessageState getState() {
    return state;
  }

  public synchronized void transitionTo(MessageState next) {
    if (state.isTerminal()) {
      throw new IllegalStateException(
          String.format("message %s already reached terminal state %s", message, state));
    }
    state = next;
  }

  /**
   * Moves to {@code next} unless a terminal state was already reached, e.g. when a forced shutdown
   * abandoned the message while a worker was still running it.
   *
   * @return true if the transition happened.
   */
  public synchronized boolean transitionIfActive(MessageState next) {
    if (state.isTerminal()) {
      return false;
    }
    state = next;
    return true;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("message", message)
        .add("attemptNumber", attemptNumber)
        .add("state", state)
        .toString();
  }
}
