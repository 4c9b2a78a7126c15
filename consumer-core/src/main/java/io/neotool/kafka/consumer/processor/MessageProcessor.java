package io.neotool.kafka.consumer.processor;

/**
 * MessageProcessor is the business function plugged into the consumer.
 *
 * <p>It may be invoked more than once for the same message (at-least-once), so implementations
 * should be idempotent, for example by keying side effects on {@link #getRecordId}.
 *
 * @param <V> payload type.
 */
public interface MessageProcessor<V> {

  /**
   * Processes one payload.
   *
   * @param payload the deserialized message.
   * @throws ValidationException if the payload is malformed or semantically invalid. Never retried.
   * @throws ProcessingException on transient failure. Retried with backoff, unless it is a {@link
   *     PermanentProcessingException}.
   */
  void process(V payload) throws ValidationException, ProcessingException;

  /** @return an identifier used to correlate logs and DLQ entries. */
  String getRecordId(V payload);
}
