package io.neotool.kafka.consumer.commit;

import com.google.common.annotations.VisibleForTesting;
import com.uber.m3.tally.Scope;
import com.uber.m3.tally.Stopwatch;
import io.neotool.kafka.consumer.common.CoreInfra;
import io.neotool.kafka.consumer.common.StructuredLogging;
import io.neotool.kafka.consumer.common.StructuredTags;
import io.neotool.kafka.consumer.message.PendingCommit;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.kafka.clients.consumer.CommitFailedException;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OffsetCommitCoordinator batches resolved offsets and commits them from the poll thread.
 *
 * <p>Workers call {@link #recordResolved} from any thread; it only appends to a lock-free queue.
 * {@link #flush} must be called from the thread that owns the Kafka consumer. It folds the queue
 * into a per-partition maximum and commits every assigned partition whose position moved past the
 * last committed offset. Positions only move forward.
 *
 * <p>Every assignment announced through {@link #onPartitionsAssigned} starts a new generation.
 * Resolutions carry the generation their message was received in, and those from an earlier
 * generation are dropped, so a message that finishes after its partition was revoked can never
 * commit over the offsets of a later owner. Partitions that were never announced are tracked with
 * {@link #UNTRACKED_GENERATION}.
 */
public class OffsetCommitCoordinator {
  private static final Logger LOGGER = LoggerFactory.getLogger(OffsetCommitCoordinator.class);
  private static final long COMMIT_RETRY_BACKOFF_MS = 100;
  public static final long UNTRACKED_GENERATION = 0L;

  private final Queue<PendingCommit> resolved = new ConcurrentLinkedQueue<>();
  private final ConcurrentMap<TopicPartition, CommitInfo> commitInfos = new ConcurrentHashMap<>();
  private final AtomicLong lastGeneration = new AtomicLong(UNTRACKED_GENERATION);
  private final String consumerGroup;
  private final Duration commitTimeout;
  private final Scope scope;

  public OffsetCommitCoordinator(String consumerGroup, Duration commitTimeout, CoreInfra infra) {
    this.consumerGroup = consumerGroup;
    this.commitTimeout = commitTimeout;
    this.scope = infra.scope();
  }

  /** Records that the message at {@code offset} has reached its final outcome. */
  public void recordResolved(TopicPartition topicPartition, long offset) {
    recordResolved(topicPartition, offset, UNTRACKED_GENERATION);
  }

  /**
   * Records that the message at {@code offset}, received in assignment {@code generation}, has
   * reached its final outcome.
   */
  public void recordResolved(TopicPartition topicPartition, long offset, long generation) {
    resolved.add(new PendingCommit(topicPartition, offset, generation));
  }

  /** @return the current assignment generation of the partition. */
  public long generation(TopicPartition topicPartition) {
    CommitInfo info = commitInfos.get(topicPartition);
    return info == null ? UNTRACKED_GENERATION : info.getGeneration();
  }

  /** @return true if this member still owns the partition in {@code generation}. */
  public boolean isCurrent(TopicPartition topicPartition, long generation) {
    CommitInfo info = commitInfos.get(topicPartition);
    if (generation == UNTRACKED_GENERATION) {
      return info == null || info.getGeneration() == UNTRACKED_GENERATION;
    }
    return info != null && info.getGeneration() == generation;
  }

  /** Starts a new generation with fresh bookkeeping. Runs inside the rebalance callback. */
  public void onPartitionsAssigned(Collection<TopicPartition> assigned) {
    for (TopicPartition tp : assigned) {
      commitInfos.put(tp, new CommitInfo(tp, lastGeneration.incrementAndGet()));
    }
    LOGGER.info(MetricNames.ASSIGNED, StructuredLogging.kafkaTopicPartitions(assigned));
  }

  /**
   * Commits everything resolved so far. Failures are logged and counted; the offsets stay pending
   * and are retried by the next flush.
   *
   * @return the offsets that were committed.
   */
  public Map<TopicPartition, OffsetAndMetadata> flush(Consumer<?, ?> consumer) {
    drainResolved();
    Set<TopicPartition> assignment = consumer.assignment();
    Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>();
    commitInfos.forEach(
        (tp, info) -> {
          if (assignment.contains(tp) && info.isEligibleToCommit()) {
            offsets.put(tp, new OffsetAndMetadata(info.getOffsetToCommit()));
          }
        });
    if (offsets.isEmpty()) {
      return offsets;
    }
    if (commitSync(consumer, offsets)) {
      return offsets;
    }
    return new HashMap<>();
  }

  /** Flushes, then forgets the revoked partitions. Runs inside the rebalance callback. */
  public void onPartitionsRevoked(Consumer<?, ?> consumer, Collection<TopicPartition> revoked) {
    flush(consumer);
    for (TopicPartition tp : revoked) {
      commitInfos.remove(tp);
    }
    LOGGER.info(MetricNames.REVOKED, StructuredLogging.kafkaTopicPartitions(revoked));
  }

  /** Forgets lost partitions without committing; another member may already own them. */
  public void onPartitionsLost(Collection<TopicPartition> lost) {
    drainResolved();
    for (TopicPartition tp : lost) {
      commitInfos.remove(tp);
    }
    LOGGER.warn(MetricNames.LOST, StructuredLogging.kafkaTopicPartitions(lost));
  }

  /** @return the last offset committed for the partition, or -1. */
  public long committedOffset(TopicPartition topicPartition) {
    CommitInfo info = commitInfos.get(topicPartition);
    return info == null ? CommitInfo.NO_OFFSET : info.getCommittedOffset();
  }

  /**
   * Folds queued resolutions first, so it reflects every {@link #recordResolved} call made before
   * it. Meant for the poll thread and tests.
   *
   * @return the offset the next commit would write for the partition, or -1.
   */
  public long pendingOffset(TopicPartition topicPartition) {
    drainResolved();
    CommitInfo info = commitInfos.get(topicPartition);
    return info == null ? CommitInfo.NO_OFFSET : info.getOffsetToCommit();
  }

  @VisibleForTesting
  int queuedResolutions() {
    return resolved.size();
  }

  private void drainResolved() {
    PendingCommit pending;
    while ((pending = resolved.poll()) != null) {
      TopicPartition tp = pending.getTopicPartition();
      if (!isCurrent(tp, pending.getGeneration())) {
        // resolved after the partition was revoked; a later owner may have committed past it.
        tagged(tp).counter(MetricNames.OFFSET_STALE).inc(1);
        LOGGER.debug(
            MetricNames.OFFSET_STALE,
            StructuredLogging.kafkaTopic(tp.topic()),
            StructuredLogging.kafkaPartition(tp.partition()),
            StructuredLogging.kafkaOffset(pending.getOffset()));
        continue;
      }
      CommitInfo info =
          commitInfos.computeIfAbsent(tp, t -> new CommitInfo(t, UNTRACKED_GENERATION));
      if (!info.advanceOffsetToCommit(pending.offsetToCommit())) {
        // an out of order resolution must never move the commit position backwards.
        tagged(pending.getTopicPartition()).counter(MetricNames.OFFSET_REGRESSION).inc(1);
        LOGGER.debug(
            MetricNames.OFFSET_REGRESSION,
            StructuredLogging.kafkaTopic(pending.getTopicPartition().topic()),
            StructuredLogging.kafkaPartition(pending.getTopicPartition().partition()),
            StructuredLogging.kafkaOffset(pending.offsetToCommit()),
            StructuredLogging.committedOffset(info.getOffsetToCommit()));
      }
    }
  }

  private boolean commitSync(
      Consumer<?, ?> consumer, Map<TopicPartition, OffsetAndMetadata> offsets) {
    Stopwatch stopwatch =
        scope
            .tagged(StructuredTags.builder().setKafkaGroup(consumerGroup).build())
            .timer(MetricNames.OFFSET_COMMIT_LATENCY)
            .start();
    try {
      try {
        consumer.commitSync(offsets, commitTimeout);
      } catch (CommitFailedException e) {
        LOGGER.warn(
            MetricNames.OFFSET_COMMIT_RETRY,
            StructuredLogging.kafkaGroup(consumerGroup),
            StructuredLogging.count(offsets.size()),
            e);
        scope.counter(MetricNames.OFFSET_COMMIT_RETRY).inc(1);
        Thread.sleep(COMMIT_RETRY_BACKOFF_MS);
        consumer.commitSync(offsets, commitTimeout);
      }
      onCommitSuccess(offsets);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      onCommitFailure(offsets, e);
      return false;
    } catch (Exception e) {
      onCommitFailure(offsets, e);
      return false;
    } finally {
      stopwatch.stop();
    }
  }

  private void onCommitSuccess(Map<TopicPartition, OffsetAndMetadata> offsets) {
    LOGGER.debug("committed offsets", StructuredLogging.count(offsets.size()));
    offsets.forEach(
        (tp, offsetMeta) -> {
          CommitInfo info = commitInfos.get(tp);
          if (info != null) {
            info.setCommittedOffset(offsetMeta.offset());
          }
          LOGGER.debug(
              "successfully committed offset",
              StructuredLogging.kafkaGroup(consumerGroup),
              StructuredLogging.kafkaTopic(tp.topic()),
              StructuredLogging.kafkaPartition(tp.partition()),
              StructuredLogging.kafkaOffset(offsetMeta.offset()));
          Scope tagged = tagged(tp);
          tagged.counter(MetricNames.OFFSET_COMMIT_SUCCESS).inc(1);
          tagged.gauge(MetricNames.OFFSET).update(offsetMeta.offset());
        });
  }

  private void onCommitFailure(Map<TopicPartition, OffsetAndMetadata> offsets, Exception e) {
    offsets.forEach(
        (tp, offsetMeta) -> {
          LOGGER.error(
              "failed to commit offset",
              StructuredLogging.kafkaGroup(consumerGroup),
              StructuredLogging.kafkaTopic(tp.topic()),
              StructuredLogging.kafkaPartition(tp.partition()),
              StructuredLogging.kafkaOffset(offsetMeta.offset()),
              e);
          tagged(tp).counter(MetricNames.OFFSET_COMMIT_FAILURE).inc(1);
        });
  }

  private Scope tagged(TopicPartition tp) {
    return scope.tagged(
        StructuredTags.builder().setKafkaGroup(consumerGroup).setTopicPartition(tp).build());
  }

  private static class MetricNames {
    static final String OFFSET_COMMIT_SUCCESS = "consumer.offset.commit.success";
    static final String OFFSET_COMMIT_FAILURE = "consumer.offset.commit.failure";
    static final String OFFSET_COMMIT_RETRY = "consumer.offset.commit.retry";
    static final String OFFSET_COMMIT_LATENCY = "consumer.offset.commit.latency";
    static final String OFFSET_REGRESSION = "consumer.offset.regression";
    static final String OFFSET_STALE = "consumer.offset.stale";
    static final String OFFSET = "consumer.offset";
    static final String ASSIGNED = "consumer.offset.assigned";
    static final String REVOKED = "consumer.offset.revoked";
    static final String LOST = "consumer.offset.lost";
  }
}
