package io.neotool.kafka.consumer.processor;

/** Thrown when a payload is malformed or semantically invalid. Routed to the DLQ without retry. */
public class ValidationException extends Exception {
  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
