package io.neotool.kafka.instrumentation;

/**
 * Tags is a common set of constant key-value tags shared by structured Json logging and metrics
 * emitted through {@link Instrument}.
 */
public class Tags {
  public static class Key {
    public static final String reason = "reason";
    public static final String result = "result";
    public static final String attempt = "attempt";
  }

  public static class Value {
    public static final String success = "success";
    public static final String failure = "failure";
  }
}
