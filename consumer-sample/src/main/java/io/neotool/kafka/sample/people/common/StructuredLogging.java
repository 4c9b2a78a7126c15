package io.neotool.kafka.sample.people.common;

import javax.annotation.Nullable;
import net.logstash.logback.argument.StructuredArgument;
import net.logstash.logback.argument.StructuredArguments;

/** Adds people record fields to the consumer's structured logging keys. */
public class StructuredLogging extends io.neotool.kafka.consumer.common.StructuredLogging {
  private static final String BATCH_ID = "batch_id";
  private static final String PERSON_NAME = "person_name";

  public static StructuredArgument batchId(@Nullable String batchId) {
    return StructuredArguments.keyValue(BATCH_ID, batchId);
  }

  public static StructuredArgument personName(@Nullable String name) {
    return StructuredArguments.keyValue(PERSON_NAME, name);
  }
}
