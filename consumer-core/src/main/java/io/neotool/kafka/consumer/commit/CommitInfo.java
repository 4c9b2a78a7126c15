package io.neotool.kafka.consumer.commit;

import java.util.concurrent.atomic.AtomicLong;
import org.apache.kafka.common.TopicPartition;

/**
 * In-memory offset bookkeeping for one assigned partition.
 *
 * <p>Each assignment of the partition to this member gets a new generation. Resolutions from an
 * older generation belong to a previous owner period and are never applied.
 */
public final class CommitInfo {
  static final long NO_OFFSET = -1L;

  private final TopicPartition topicPartition;
  private final long generation;
  // next offset to consume, i.e. highest resolved offset + 1
  private final AtomicLong offsetToCommit = new AtomicLong(NO_OFFSET);
  // offset already persisted on the broker by this consumer.
  private final AtomicLong committedOffset = new AtomicLong(NO_OFFSET);

  CommitInfo(TopicPartition topicPartition, long generation) {
    this.topicPartition = topicPartition;
    this.generation = generation;
  }

  public TopicPartition getTopicPartition() {
    return topicPartition;
  }

  public long getGeneration() {
    return generation;
  }

  public long getOffsetToCommit() {
    return offsetToCommit.get();
  }

  public long getCommittedOffset() {
    return committedOffset.get();
  }

  /**
   * Moves the commit position forward.
   *
   * @return false if the offset would move the position backwards, in which case it is ignored.
   */
  boolean advanceOffsetToCommit(long offset) {
    long previous = offsetToCommit.getAndAccumulate(offset, Math::max);
    return offset > previous;
  }

  void setCommittedOffset(long offset) {
    committedOffset.accumulateAndGet(offset, Math::max);
  }

  boolean isEligibleToCommit() {
    return offsetToCommit.get() > committedOffset.get();
  }
}
