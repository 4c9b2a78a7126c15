package io.neotool.kafka.consumer.common;

/** Field names shared by structured logs and metric tags. */
public class StructuredFields {
  public static final String KAFKA_TOPIC = "kafka_topic";
  public static final String KAFKA_GROUP = "kafka_group";
  public static final String KAFKA_PARTITION = "kafka_partition";
  public static final String KAFKA_OFFSET = "kafka_offset";
  public static final String COMMITTED_OFFSET = "committed_offset";
  public static final String RECORD_ID = "record_id";
  public static final String ERROR_TYPE = "error_type";
  public static final String RETRY_COUNT = "retry_count";
  public static final String MESSAGE_STATE = "message_state";
}
