package io.neotool.kafka.consumer.fetcher;

import com.google.common.annotations.VisibleForTesting;
import com.uber.m3.tally.Scope;
import com.uber.m3.tally.Stopwatch;
import io.neotool.kafka.consumer.SequencedMessageConsumer;
import io.neotool.kafka.consumer.commit.OffsetCommitCoordinator;
import io.neotool.kafka.consumer.common.CoreInfra;
import io.neotool.kafka.consumer.common.StructuredLogging;
import io.neotool.kafka.consumer.common.StructuredTags;
import io.neotool.kafka.consumer.common.utils.ShutdownableThread;
import io.neotool.kafka.consumer.config.ConsumerConfiguration;
import io.neotool.kafka.consumer.message.InboundMessage;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.internals.FatalExitError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * KafkaConsumerThread owns the Kafka consumer. It is the only thread that touches it.
 *
 * <p>Each {@link #doWork()} iteration:
 *
 * <ol>
 *   <li>polls the broker.
 *   <li>hands every record to the {@link SequencedMessageConsumer}. A rejected record rewinds and
 *       pauses its partition.
 *   <li>pauses partitions with a deep backlog or a failed dead letter publish, resumes the ones
 *       that drained.
 *   <li>flushes resolved offsets every {@code offsetCommitIntervalMs}.
 * </ol>
 *
 * <p>{@link #close()} stops the loop, pauses every assignment, drains the engine within the
 * shutdown timeout, commits once more and closes the consumer.
 */
public class KafkaConsumerThread<V> extends ShutdownableThread {
  private static final Logger LOGGER = LoggerFactory.getLogger(KafkaConsumerThread.class);

  private final Consumer<String, V> consumer;
  private final SequencedMessageConsumer<V> engine;
  private final OffsetCommitCoordinator commitCoordinator;
  private final String topic;
  private final String consumerGroup;
  private final Duration pollTimeout;
  private final long offsetCommitIntervalMs;
  private final int maxQueuedMessagesPerPartition;
  private final Duration shutdownTimeout;
  private final Clock clock;
  private final Scope scope;
  private long lastCommitCheckMs = -1L;

  public KafkaConsumerThread(
      String threadName,
      String topic,
      String consumerGroup,
      ConsumerConfiguration config,
      Consumer<String, V> consumer,
      SequencedMessageConsumer<V> engine,
      OffsetCommitCoordinator commitCoordinator,
      CoreInfra infra) {
    this(
        threadName,
        topic,
        consumerGroup,
        config,
        consumer,
        engine,
        commitCoordinator,
        Clock.systemUTC(),
        infra);
  }

  @VisibleForTesting
  KafkaConsumerThread(
      String threadName,
      String topic,
      String consumerGroup,
      ConsumerConfiguration config,
      Consumer<String, V> consumer,
      SequencedMessageConsumer<V> engine,
      OffsetCommitCoordinator commitCoordinator,
      Clock clock,
      CoreInfra infra) {
    // kafka consumer calls must not be interrupted
    super(threadName, false);
    this.consumer = consumer;
    this.engine = engine;
    this.commitCoordinator = commitCoordinator;
    this.topic = topic;
    this.consumerGroup = consumerGroup;
    this.pollTimeout = Duration.ofMillis(config.getPollTimeoutMs());
    this.offsetCommitIntervalMs = config.getOffsetCommitIntervalMs();
    this.maxQueuedMessagesPerPartition = config.getMaxQueuedMessagesPerPartition();
    this.shutdownTimeout = config.getShutdownTimeout();
    this.clock = clock;
    this.scope =
        infra
            .scope()
            .tagged(
                StructuredTags.builder().setKafkaGroup(consumerGroup).setKafkaTopic(topic).build());
    consumer.subscribe(Collections.singletonList(topic), new RebalanceListener());
  }

  @Override
  public void doWork() {
    try {
      pollOnce();
      applyBackpressure();
      maybeCommit();
    } catch (WakeupException e) {
      if (isRunning()) {
        LOGGER.warn("consumer.poll.wakeup", StructuredLogging.kafkaTopic(topic), e);
      }
    } catch (FatalExitError e) {
      throw e;
    } catch (Throwable t) {
      scope.counter(MetricNames.DO_WORK_FAILURE).inc(1);
      LOGGER.error(
          "failed to doWork",
          StructuredLogging.kafkaGroup(consumerGroup),
          StructuredLogging.kafkaTopic(topic),
          t);
      try {
        // avoid a hot loop on a persistent broker failure
        pause(pollTimeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  @VisibleForTesting
  void pollOnce() {
    ConsumerRecords<String, V> records;
    Stopwatch pollTimer = scope.timer(MetricNames.POLL_LATENCY).start();
    try {
      records = consumer.poll(pollTimeout);
    } catch (KafkaException e) {
      scope.counter(MetricNames.POLL_EXCEPTION).inc(1);
      throw e;
    } finally {
      pollTimer.stop();
    }
    if (records.isEmpty()) {
      return;
    }
    scope.counter(MetricNames.RECORDS_POLLED).inc(records.count());
    for (TopicPartition tp : records.partitions()) {
      for (ConsumerRecord<String, V> record : records.records(tp)) {
        InboundMessage<V> message =
            new InboundMessage<>(
                record.key(),
                record.topic(),
                record.partition(),
                record.offset(),
                record.value(),
                clock.instant());
        if (!engine.handle(message)) {
          // redeliver this and later records of the partition once it is resumed or reassigned.
          pausePartitionAndSeekOffset(tp, record.offset(), "message rejected");
          break;
        }
      }
    }
  }

  @VisibleForTesting
  void applyBackpressure() {
    Set<TopicPartition> blocked = engine.blockedPartitions();
    Set<TopicPartition> paused = consumer.paused();
    Set<TopicPartition> toResume = new HashSet<>();
    for (TopicPartition tp : consumer.assignment()) {
      boolean isBlocked = blocked.contains(tp);
      boolean isBacklogged = engine.queuedCount(tp) >= maxQueuedMessagesPerPartition;
      if (isBlocked || isBacklogged) {
        if (!paused.contains(tp)) {
          pausePartitionAndSeekOffset(tp, -1L, isBlocked ? "dlq blocked" : "backlog");
        }
      } else if (paused.contains(tp)) {
        toResume.add(tp);
      }
    }
    if (!toResume.isEmpty()) {
      consumer.resume(toResume);
      scope.counter(MetricNames.TOPIC_PARTITION_RESUME).inc(toResume.size());
      LOGGER.info("kafka.resume", StructuredLogging.kafkaTopicPartitions(toResume));
    }
  }

  @VisibleForTesting
  void maybeCommit() {
    long now = clock.millis();
    if (now - lastCommitCheckMs >= offsetCommitIntervalMs) {
      lastCommitCheckMs = now;
      commitCoordinator.flush(consumer);
    }
  }

  private void pausePartitionAndSeekOffset(TopicPartition tp, long offset, String reason) {
    consumer.pause(Collections.singleton(tp));
    if (offset >= 0) {
      consumer.seek(tp, offset);
    }
    LOGGER.warn(
        "kafka.pause",
        StructuredLogging.kafkaGroup(consumerGroup),
        StructuredLogging.kafkaTopic(tp.topic()),
        StructuredLogging.kafkaPartition(tp.partition()),
        StructuredLogging.reason(reason));
    scope
        .tagged(StructuredTags.builder().setTopicPartition(tp).build())
        .counter(MetricNames.TOPIC_PARTITION_PAUSED)
        .inc(1);
  }

  /**
   * Stops the poll loop, then drains the engine and closes the consumer on the calling thread.
   * Must not be called from the poll thread.
   */
  public void close() {
    // stopping doWork first keeps the consumer confined to a single thread at a time.
    try {
      shutdown();
    } catch (InterruptedException e) {
      log.warn("Interrupted while shutting down KafkaConsumerThread", e);
      Thread.currentThread().interrupt();
    }
    cleanup();
  }

  private void cleanup() {
    try {
      consumer.pause(consumer.assignment());
      boolean drained = engine.shutdown(shutdownTimeout);
      // commit offsets for the last time
      commitCoordinator.flush(consumer);
      consumer.close();
      scope.counter(MetricNames.CLOSE_SUCCESS).inc(1);
      LOGGER.info(
          MetricNames.CLOSE_SUCCESS,
          StructuredLogging.kafkaGroup(consumerGroup),
          StructuredLogging.kafkaTopic(topic),
          StructuredLogging.reason(drained ? "drained" : "timeout"));
    } catch (Exception e) {
      LOGGER.error(MetricNames.CLOSE_FAILURE, e);
      scope.counter(MetricNames.CLOSE_FAILURE).inc(1);
      throw new RuntimeException(e);
    }
  }

  private final class RebalanceListener implements ConsumerRebalanceListener {
    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
      LOGGER.info("kafka.partitions.revoked", StructuredLogging.kafkaTopicPartitions(partitions));
      engine.onPartitionsRevoked(partitions);
      commitCoordinator.onPartitionsRevoked(consumer, partitions);
    }

    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
      LOGGER.info(
          "kafka.partitions.assigned", StructuredLogging.kafkaTopicPartitions(partitions));
      commitCoordinator.onPartitionsAssigned(partitions);
      scope.gauge(MetricNames.ASSIGNED_PARTITIONS).update(consumer.assignment().size());
    }

    @Override
    public void onPartitionsLost(Collection<TopicPartition> partitions) {
      LOGGER.warn("kafka.partitions.lost", StructuredLogging.kafkaTopicPartitions(partitions));
      engine.onPartitionsRevoked(partitions);
      commitCoordinator.onPartitionsLost(partitions);
    }
  }

  private static class MetricNames {
    static final String POLL_LATENCY = "consumer.kafka.poll.latency";
    static final String POLL_EXCEPTION = "consumer.kafka.poll.exception";
    static final String RECORDS_POLLED = "consumer.kafka.records.polled";
    static final String DO_WORK_FAILURE = "consumer.kafka.dowork.failure";
    static final String TOPIC_PARTITION_PAUSED = "consumer.kafka.topic.partition.paused";
    static final String TOPIC_PARTITION_RESUME = "consumer.kafka.topic.partition.resume";
    static final String ASSIGNED_PARTITIONS = "consumer.kafka.assigned.partitions";
    static final String CLOSE_SUCCESS = "consumer.kafka.close.success";
    static final String CLOSE_FAILURE = "consumer.kafka.close.failure";
  }
}
