package io.neotool.kafka.consumer.processor;

/**
 * A processing failure that will not succeed on retry, for example a referenced entity that no
 * longer exists. Routed to the DLQ without further attempts.
 */
public class PermanentProcessingException extends ProcessingException {
  public PermanentProcessingException(String message) {
    super(message);
  }

  public PermanentProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
