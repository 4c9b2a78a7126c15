package io.neotool.kafka.consumer.sequencer;

import com.google.common.base.MoreObjects;
import io.neotool.kafka.consumer.common.CoreInfra;
import io.neotool.kafka.consumer.common.StructuredLogging;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PartitionSequencer guarantees that at most one message per topic partition is in flight.
 *
 * <p>Each partition has a lane holding the current permit and a FIFO of waiting tasks. A task runs
 * when it obtains the permit; releasing the permit hands the lane to the next waiting task on the
 * releasing thread. Different partitions never block each other.
 *
 * <p>A lane drains iteratively: when a task releases its permit synchronously from inside {@link
 * SequencedTask#run}, the thread already draining the lane picks up the next task, so the stack
 * does not grow with the queue.
 */
public class PartitionSequencer {
  private static final Logger LOGGER = LoggerFactory.getLogger(PartitionSequencer.class);

  // lanes live as long as the consumer; the set of partitions is bounded by the topic.
  private final ConcurrentMap<TopicPartition, Lane> lanes = new ConcurrentHashMap<>();
  private final CoreInfra infra;

  public PartitionSequencer(CoreInfra infra) {
    this.infra = infra;
  }

  /**
   * Grants the permit immediately if the partition is idle and nothing is queued.
   *
   * @return the permit, or empty if another message holds or awaits the partition.
   */
  public Optional<PartitionPermit> tryAdmit(TopicPartition topicPartition) {
    return Optional.ofNullable(lane(topicPartition).tryAdmit());
  }

  /**
   * Runs the task once it owns the partition. Runs inline when the partition is idle, otherwise
   * queues the task behind earlier ones.
   */
  public void submit(TopicPartition topicPartition, SequencedTask task) {
    Lane lane = lane(topicPartition);
    lane.enqueue(task);
    lane.drain();
  }

  /** @return number of tasks waiting for the partition, excluding the permit holder. */
  public int queuedCount(TopicPartition topicPartition) {
    Lane lane = lanes.get(topicPartition);
    return lane == null ? 0 : lane.queuedCount();
  }

  /** @return true if no permit is held and nothing is queued for the partition. */
  public boolean isIdle(TopicPartition topicPartition) {
    Lane lane = lanes.get(topicPartition);
    return lane == null || lane.isIdle();
  }

  /**
   * Drops every task waiting for the partition and abandons them. The current permit, if any, is
   * left to its holder.
   *
   * @return number of dropped tasks.
   */
  public int clear(TopicPartition topicPartition) {
    Lane lane = lanes.get(topicPartition);
    if (lane == null) {
      return 0;
    }
    List<SequencedTask> dropped = lane.drainQueue();
    for (SequencedTask task : dropped) {
      try {
        task.abandon();
      } catch (RuntimeException e) {
        LOGGER.warn(
            MetricNames.ABANDON_FAILURE,
            StructuredLogging.kafkaTopic(topicPartition.topic()),
            StructuredLogging.kafkaPartition(topicPartition.partition()),
            e);
      }
    }
    if (!dropped.isEmpty()) {
      infra.scope().counter(MetricNames.CLEARED).inc(dropped.size());
      LOGGER.info(
          MetricNames.CLEARED,
          StructuredLogging.kafkaTopic(topicPartition.topic()),
          StructuredLogging.kafkaPartition(topicPartition.partition()),
          StructuredLogging.count(dropped.size()));
    }
    return dropped.size();
  }

  private Lane lane(TopicPartition topicPartition) {
    return lanes.computeIfAbsent(topicPartition, Lane::new);
  }

  private final class Lane {
    private final TopicPartition topicPartition;
    private final Deque<SequencedTask> waiting = new ArrayDeque<>();
    @Nullable private Permit current;
    private boolean draining;

    Lane(TopicPartition topicPartition) {
      this.topicPartition = topicPartition;
    }

    @Nullable
    synchronized Permit tryAdmit() {
      if (current != null || !waiting.isEmpty()) {
        return null;
      }
      current = new Permit(this);
      return current;
    }

    synchronized void enqueue(SequencedTask task) {
      waiting.addLast(task);
    }

    synchronized int queuedCount() {
      return waiting.size();
    }

    synchronized boolean isIdle() {
      return current == null && waiting.isEmpty();
    }

    synchronized List<SequencedTask> drainQueue() {
      List<SequencedTask> tasks = new ArrayList<>(waiting);
      waiting.clear();
      return tasks;
    }

    void release(Permit permit) {
      synchronized (this) {
        if (current != permit) {
          return;
        }
        current = null;
      }
      drain();
    }

    void drain() {
      synchronized (this) {
        if (draining) {
          return;
        }
        draining = true;
      }
      boolean stopped = false;
      try {
        while (true) {
          SequencedTask task;
          Permit permit;
          synchronized (this) {
            if (current != null || waiting.isEmpty()) {
              draining = false;
              stopped = true;
              return;
            }
            task = waiting.pollFirst();
            permit = new Permit(this);
            current = permit;
          }
          runTask(task, permit);
        }
      } finally {
        if (!stopped) {
          synchronized (this) {
            draining = false;
          }
        }
      }
    }

    private void runTask(SequencedTask task, Permit permit) {
      try {
        task.run(permit);
      } catch (RuntimeException e) {
        // a task that throws before handing off can never release the lane itself.
        infra.scope().counter(MetricNames.TASK_FAILURE).inc(1);
        LOGGER.error(
            MetricNames.TASK_FAILURE,
            StructuredLogging.kafkaTopic(topicPartition.topic()),
            StructuredLogging.kafkaPartition(topicPartition.partition()),
            e);
        permit.release();
      }
    }
  }

  private static final class Permit implements PartitionPermit {
    private final Lane lane;
    private final AtomicBoolean released = new AtomicBoolean(false);

    Permit(Lane lane) {
      this.lane = lane;
    }

    @Override
    public TopicPartition topicPartition() {
      return lane.topicPartition;
    }

    @Override
    public void release() {
      if (released.compareAndSet(false, true)) {
        lane.release(this);
      }
    }

    @Override
    public boolean isReleased() {
      return released.get();
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("topicPartition", lane.topicPartition)
          .add("released", released.get())
          .toString();
    }
  }

  private static class MetricNames {
    static final String CLEARED = "consumer.sequencer.cleared";
    static final String TASK_FAILURE = "consumer.sequencer.task.failure";
    static final String ABANDON_FAILURE = "consumer.sequencer.abandon.failure";
  }
}
