package io.neotool.kafka.consumer.message;

import com.google.common.base.MoreObjects;
import java.time.Instant;
import java.util.Objects;
import javax.annotation.Nullable;
import org.apache.kafka.common.TopicPartition;

/**
 * InboundMessage is a record delivered by the broker, as handed from the poll thread to the
 * processing engine. Immutable.
 *
 * @param <V> type of the deserialized payload.
 */
public final class InboundMessage<V> {
  @Nullable private final String key;
  private final String topic;
  private final int partition;
  private final long offset;
  private final V payload;
  private final Instant receivedAt;

  public InboundMessage(
      @Nullable String key,
      String topic,
      int partition,
      long offset,
      V payload,
      Instant receivedAt) {
    this.key = key;
    this.topic = Objects.requireNonNull(topic, "topic");
    this.partition = partition;
    this.offset = offset;
    this.payload = Objects.requireNonNull(payload, "payload");
    this.receivedAt = Objects.requireNonNull(receivedAt, "receivedAt");
  }

  @Nullable
  public String getKey() {
    return key;
  }

  public String getTopic() {
    return topic;
  }

  public int getPartition() {
    return partition;
  }

  public long getOffset() {
    return offset;
  }

  public V getPayload() {
    return payload;
  }

  public Instant getReceivedAt() {
    return receivedAt;
  }

  public TopicPartition topicPartition() {
    return new TopicPartition(topic, partition);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("key", key)
        .add("topic", topic)
        .add("partition", partition)
        .add("offset", offset)
        .toString();
  }
}
