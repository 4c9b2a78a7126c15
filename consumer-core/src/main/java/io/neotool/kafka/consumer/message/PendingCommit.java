package io.neotool.kafka.consumer.message;

import java.util.Objects;
import org.apache.kafka.common.TopicPartition;

/** A resolved message whose offset may be committed. */
public final class PendingCommit {
  private final TopicPartition topicPartition;
  private final long offset;
  private final long generation;

  public PendingCommit(TopicPartition topicPartition, long offset) {
    this(topicPartition, offset, 0L);
  }

  /**
   * @param generation assignment generation the message was received in, 0 when the partition's
   *     assignment is not tracked.
   */
  public PendingCommit(TopicPartition topicPartition, long offset, long generation) {
    this.topicPartition = topicPartition;
    this.offset = offset;
    this.generation = generation;
  }

  public TopicPartition getTopicPartition() {
    return topicPartition;
  }

  public long getOffset() {
    return offset;
  }

  public long getGeneration() {
    return generation;
  }

  /** Kafka commits the position of the next record to consume. */
  public long offsetToCommit() {
    return offset + 1;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    PendingCommit that = (PendingCommit) o;
    return offset == that.offset
        && generation == that.generation
        && topicPartition.equals(that.topicPartition);
  }

  @Override
  public int hashCode() {
    return Objects.hash(topicPartition, offset, generation);
  }

  @Override
  public String toString() {
    return topicPartition + "@" + offset;
  }
}
