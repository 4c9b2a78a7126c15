package io.neotool.kafka.consumer.processor;

/** Thrown when processing fails for a transient reason, such as an unavailable dependency. */
public class ProcessingException extends Exception {
  public ProcessingException(String message) {
    super(message);
  }

  public ProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
