package io.neotool.kafka.consumer.common;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.apache.kafka.common.TopicPartition;

/** Builder for metric tag maps passed to {@code Scope.tagged}. */
public final class StructuredTags extends StructuredFields {

  private final ImmutableMap.Builder<String, String> mapBuilder;

  private StructuredTags() {
    mapBuilder = new ImmutableMap.Builder<>();
  }

  public static StructuredTags builder() {
    return new StructuredTags();
  }

  public StructuredTags setKafkaGroup(String consumerGroup) {
    this.mapBuilder.put(KAFKA_GROUP, consumerGroup);
    return this;
  }

  public StructuredTags setKafkaTopic(String topic) {
    this.mapBuilder.put(KAFKA_TOPIC, topic);
    return this;
  }

  public StructuredTags setKafkaPartition(int partition) {
    this.mapBuilder.put(KAFKA_PARTITION, Integer.toString(partition));
    return this;
  }

  public StructuredTags setTopicPartition(TopicPartition topicPartition) {
    return setKafkaTopic(topicPartition.topic()).setKafkaPartition(topicPartition.partition());
  }

  public Map<String, String> build() {
    return this.mapBuilder.buildKeepingLast();
  }
}
