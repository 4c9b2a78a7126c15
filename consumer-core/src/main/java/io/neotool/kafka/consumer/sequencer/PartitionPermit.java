package io.neotool.kafka.consumer.sequencer;

import org.apache.kafka.common.TopicPartition;

/**
 * Exclusive right to process the head message of one topic partition. Releasing is idempotent and
 * hands the partition to the next queued message, if any.
 */
public interface PartitionPermit {
  TopicPartition topicPartition();

  void release();

  boolean isReleased();
}
