package io.neotool.kafka.consumer.dlq;

/**
 * Destination for messages that cannot be processed.
 *
 * @param <V> type of the original payload.
 */
public interface DlqPublisher<V> {

  /**
   * Publishes the envelope.
   *
   * @return true once the envelope is durably accepted. False and a thrown exception are both
   *     treated as a failed attempt.
   */
  boolean publish(DlqEnvelope<V> envelope) throws Exception;
}
