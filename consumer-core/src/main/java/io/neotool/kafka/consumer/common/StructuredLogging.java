package io.neotool.kafka.consumer.common;

import java.util.Collection;
import net.logstash.logback.argument.StructuredArgument;
import net.logstash.logback.argument.StructuredArguments;
import org.apache.kafka.common.TopicPartition;

/**
 * StructuredLogging generates logback StructuredArgument pairs for structured logging.
 *
 * <p>Static, typed helpers keep each key bound to a single value type so that fields do not
 * collide during log ingestion.
 */
public class StructuredLogging extends StructuredFields {
  private static final String REASON = "reason";
  private static final String COUNT = "count";
  private static final String ATTEMPT = "attempt";
  private static final String DELAY_MS = "delay_ms";
  private static final String TIMEOUT_MS = "timeout_ms";
  private static final String KAFKA_TOPIC_PARTITIONS = "kafka_topic_partitions";
  private static final String CANCELLED_TASKS = "cancelled_tasks";
  private static final String CANCELLED_RETRIES = "cancelled_retries";

  public static StructuredArgument kafkaTopic(String topic) {
    return StructuredArguments.keyValue(KAFKA_TOPIC, topic);
  }

  public static StructuredArgument kafkaGroup(String group) {
    return StructuredArguments.keyValue(KAFKA_GROUP, group);
  }

  public static StructuredArgument kafkaPartition(int partition) {
    return StructuredArguments.keyValue(KAFKA_PARTITION, partition);
  }

  public static StructuredArgument kafkaOffset(long offset) {
    return StructuredArguments.keyValue(KAFKA_OFFSET, offset);
  }

  public static StructuredArgument committedOffset(long offset) {
    return StructuredArguments.keyValue(COMMITTED_OFFSET, offset);
  }

  public static StructuredArgument kafkaTopicPartitions(Collection<TopicPartition> partitions) {
    return StructuredArguments.keyValue(KAFKA_TOPIC_PARTITIONS, partitions.toString());
  }

  public static StructuredArgument recordId(String recordId) {
    return StructuredArguments.keyValue(RECORD_ID, recordId);
  }

  public static StructuredArgument errorType(Throwable t) {
    return StructuredArguments.keyValue(ERROR_TYPE, t.getClass().getName());
  }

  public static StructuredArgument retryCount(int retryCount) {
    return StructuredArguments.keyValue(RETRY_COUNT, retryCount);
  }

  public static StructuredArgument attempt(int attempt) {
    return StructuredArguments.keyValue(ATTEMPT, attempt);
  }

  public static StructuredArgument messageState(Enum<?> state) {
    return StructuredArguments.keyValue(MESSAGE_STATE, state.name());
  }

  public static StructuredArgument delayMs(long delayMs) {
    return StructuredArguments.keyValue(DELAY_MS, delayMs);
  }

  public static StructuredArgument timeoutMs(long timeoutMs) {
    return StructuredArguments.keyValue(TIMEOUT_MS, timeoutMs);
  }

  public static StructuredArgument reason(String reason) {
    return StructuredArguments.keyValue(REASON, reason);
  }

  public static StructuredArgument count(int count) {
    return StructuredArguments.keyValue(COUNT, count);
  }

  public static StructuredArgument count(long count) {
    return StructuredArguments.keyValue(COUNT, count);
  }

  public static StructuredArgument cancelledTasks(int count) {
    return StructuredArguments.keyValue(CANCELLED_TASKS, count);
  }

  public static StructuredArgument cancelledRetries(int count) {
    return StructuredArguments.keyValue(CANCELLED_RETRIES, count);
  }
}
