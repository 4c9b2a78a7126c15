package io.neotool.kafka.consumer;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import io.neotool.kafka.consumer.commit.OffsetCommitCoordinator;
import io.neotool.kafka.consumer.common.CoreInfra;
import io.neotool.kafka.consumer.common.StructuredLogging;
import io.neotool.kafka.consumer.config.ConsumerConfiguration;
import io.neotool.kafka.consumer.dlq.DlqDispatcher;
import io.neotool.kafka.consumer.dlq.DlqEnvelope;
import io.neotool.kafka.consumer.dlq.DlqFallback;
import io.neotool.kafka.consumer.dlq.DlqOutcome;
import io.neotool.kafka.consumer.dlq.DlqPublisher;
import io.neotool.kafka.consumer.dlq.LoggingDlqFallback;
import io.neotool.kafka.consumer.executor.ProcessingExecutor;
import io.neotool.kafka.consumer.message.InboundMessage;
import io.neotool.kafka.consumer.message.MessageState;
import io.neotool.kafka.consumer.message.ProcessingAttempt;
import io.neotool.kafka.consumer.metrics.ConsumerMetrics;
import io.neotool.kafka.consumer.processor.MessageProcessor;
import io.neotool.kafka.consumer.processor.PermanentProcessingException;
import io.neotool.kafka.consumer.processor.ValidationException;
import io.neotool.kafka.consumer.retry.BackoffPolicy;
import io.neotool.kafka.consumer.retry.RetryScheduler;
import io.neotool.kafka.consumer.sequencer.PartitionPermit;
import io.neotool.kafka.consumer.sequencer.PartitionSequencer;
import io.neotool.kafka.consumer.sequencer.SequencedTask;
import io.neotool.kafka.instrumentation.Instrumentation;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import javax.annotation.Nullable;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SequencedMessageConsumer drives every received message to exactly one outcome: committed after
 * success, committed after a dead letter publish, blocked, or abandoned by shutdown.
 *
 * <p>Messages of one partition are processed strictly one at a time in offset order; partitions
 * proceed in parallel on the {@link ProcessingExecutor}. Retryable failures are rescheduled on the
 * {@link RetryScheduler} while the partition permit stays held, so later messages of the partition
 * wait for the retry. Offsets are only recorded on the {@link OffsetCommitCoordinator}; the poll
 * thread commits them.
 *
 * <p>{@link #handle} must be called from the poll thread. Everything else runs on workers, the
 * retry timer, or the thread calling {@link #shutdown}.
 *
 * @param <V> type of the deserialized payload.
 */
public class SequencedMessageConsumer<V> {
  private static final Logger LOGGER = LoggerFactory.getLogger(SequencedMessageConsumer.class);
  private static final long DRAIN_POLL_INTERVAL_MS = 10;

  private final MessageProcessor<V> processor;
  private final PartitionSequencer sequencer;
  private final ProcessingExecutor executor;
  private final RetryScheduler retryScheduler;
  private final OffsetCommitCoordinator commitCoordinator;
  private final DlqDispatcher<V> dlqDispatcher;
  private final BackoffPolicy backoffPolicy;
  private final int maxRetries;
  private final ConsumerMetrics metrics;
  private final Clock clock;
  private final CoreInfra infra;

  private final Set<ProcessingAttempt<V>> unresolved = ConcurrentHashMap.newKeySet();
  // blocked partitions keep their permit until revoked
  private final ConcurrentMap<TopicPartition, PartitionPermit> blocked = new ConcurrentHashMap<>();
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final AtomicBoolean forceStopped = new AtomicBoolean(false);
  // workers record commits under the read lock; a forced stop takes the write lock
  private final ReadWriteLock resolveLock = new ReentrantReadWriteLock();

  private SequencedMessageConsumer(Builder<V> builder) {
    ConsumerConfiguration config = builder.config;
    this.processor = builder.processor;
    this.infra = builder.infra;
    this.metrics = builder.metrics;
    this.clock = builder.clock;
    this.commitCoordinator = builder.commitCoordinator;
    this.maxRetries = config.getMaxRetries();
    this.backoffPolicy = BackoffPolicy.of(config);
    this.sequencer = builder.sequencer != null ? builder.sequencer : new PartitionSequencer(infra);
    this.executor =
        builder.executor != null ? builder.executor : ProcessingExecutor.of(config, infra);
    this.retryScheduler =
        builder.retryScheduler != null ? builder.retryScheduler : RetryScheduler.create(infra);
    this.dlqDispatcher =
        new DlqDispatcher<>(
            builder.dlqPublisher, builder.dlqFallback, config, metrics, forceStopped::get, infra);
  }

  public static <V> Builder<V> builder() {
    return new Builder<>();
  }

  /**
   * Accepts a message from the poll thread.
   *
   * @return false if the message was not accepted because the consumer is shutting down or the
   *     partition is blocked. The caller must rewind and pause the partition.
   */
  public boolean handle(InboundMessage<V> message) {
    TopicPartition tp = message.topicPartition();
    if (shuttingDown.get() || blocked.containsKey(tp)) {
      infra.scope().counter(MetricNames.REJECTED).inc(1);
      LOGGER.debug(
          MetricNames.REJECTED,
          StructuredLogging.kafkaTopic(message.getTopic()),
          StructuredLogging.kafkaPartition(message.getPartition()),
          StructuredLogging.kafkaOffset(message.getOffset()));
      return false;
    }
    ProcessingAttempt<V> attempt =
        new ProcessingAttempt<>(message, clock.instant(), commitCoordinator.generation(tp));
    unresolved.add(attempt);
    sequencer.submit(
        tp,
        new SequencedTask() {
          @Override
          public void run(PartitionPermit permit) {
            start(attempt, permit);
          }

          @Override
          public void abandon() {
            SequencedMessageConsumer.this.abandon(attempt, null);
          }
        });
    // the partition may have been blocked while this message was queued.
    if (blocked.containsKey(tp)) {
      sequencer.clear(tp);
    }
    return true;
  }

  /** Drops queued messages of revoked partitions and frees their blocked permits. */
  public void onPartitionsRevoked(Collection<TopicPartition> revoked) {
    for (TopicPartition tp : revoked) {
      sequencer.clear(tp);
      PartitionPermit permit = blocked.remove(tp);
      if (permit != null) {
        permit.release();
      }
    }
  }

  /**
   * Stops accepting messages and waits up to {@code timeout} for every accepted message to be
   * resolved. Retries keep running during the wait. Afterwards pending retries are cancelled,
   * running tasks are interrupted, and whatever is left is abandoned without a commit.
   *
   * @return true if every accepted message was resolved within the timeout.
   */
  public boolean shutdown(Duration timeout) {
    if (!shuttingDown.compareAndSet(false, true)) {
      return unresolved.isEmpty();
    }
    long deadlineNanos = System.nanoTime() + timeout.toNanos();
    LOGGER.info(
        MetricNames.SHUTDOWN_STARTED,
        StructuredLogging.count(unresolved.size()),
        StructuredLogging.timeoutMs(timeout.toMillis()));
    for (TopicPartition tp : blocked.keySet()) {
      sequencer.clear(tp);
    }
    try {
      while (!unresolved.isEmpty() && System.nanoTime() < deadlineNanos) {
        TimeUnit.MILLISECONDS.sleep(
            Math.min(
                DRAIN_POLL_INTERVAL_MS,
                Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()))));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    boolean drained = unresolved.isEmpty();

    resolveLock.writeLock().lock();
    try {
      forceStopped.set(true);
    } finally {
      resolveLock.writeLock().unlock();
    }
    int cancelledRetries = retryScheduler.cancelAll().size();
    long remainingNanos = Math.max(0, deadlineNanos - System.nanoTime());
    int cancelledTasks = executor.shutdown(Duration.ofNanos(remainingNanos));
    int abandoned = 0;
    for (ProcessingAttempt<V> attempt : unresolved) {
      if (attempt.transitionIfActive(MessageState.ABANDONED)) {
        abandoned++;
      }
      unresolved.remove(attempt);
    }
    retryScheduler.close();
    infra.scope().counter(MetricNames.ABANDONED).inc(abandoned);
    LOGGER.info(
        MetricNames.SHUTDOWN_COMPLETED,
        StructuredLogging.reason(drained ? "drained" : "timeout"),
        StructuredLogging.count(abandoned),
        StructuredLogging.cancelledRetries(cancelledRetries),
        StructuredLogging.cancelledTasks(cancelledTasks));
    return drained;
  }

  public boolean isShuttingDown() {
    return shuttingDown.get();
  }

  /** @return partitions whose dead letter publish failed; the poll thread keeps them paused. */
  public Set<TopicPartition> blockedPartitions() {
    return ImmutableSet.copyOf(blocked.keySet());
  }

  /** @return number of messages waiting for the partition, excluding the one in flight. */
  public int queuedCount(TopicPartition topicPartition) {
    return sequencer.queuedCount(topicPartition);
  }

  /** @return number of accepted messages that have not reached a final outcome. */
  public int unresolvedCount() {
    return unresolved.size();
  }

  @VisibleForTesting
  RetryScheduler retryScheduler() {
    return retryScheduler;
  }

  private void start(ProcessingAttempt<V> attempt, PartitionPermit permit) {
    if (forceStopped.get() || isStale(attempt)) {
      abandon(attempt, permit);
      return;
    }
    attempt.transitionTo(MessageState.PROCESSING);
    submitAttempt(attempt, permit);
  }

  private void resume(ProcessingAttempt<V> attempt, PartitionPermit permit) {
    if (forceStopped.get() || isStale(attempt)) {
      abandon(attempt, permit);
      return;
    }
    if (attempt.transitionIfActive(MessageState.PROCESSING)) {
      submitAttempt(attempt, permit);
    }
  }

  private void submitAttempt(ProcessingAttempt<V> attempt, PartitionPermit permit) {
    try {
      executor.submit(() -> runAttempt(attempt, permit));
    } catch (RejectedExecutionException e) {
      if (shuttingDown.get() || executor.isShutdown()) {
        abandon(attempt, permit);
        return;
      }
      // saturated: try again later without consuming a retry.
      attempt.transitionTo(MessageState.RETRY_SCHEDULED);
      retryScheduler.scheduleRetry(
          attempt, backoffPolicy.delay(1), () -> resume(attempt, permit));
    }
  }

  private void runAttempt(ProcessingAttempt<V> attempt, PartitionPermit permit) {
    try {
      process(attempt, permit);
    } catch (Throwable t) {
      onUnexpectedFailure(attempt, permit, t);
    }
  }

  private void process(ProcessingAttempt<V> attempt, PartitionPermit permit) {
    InboundMessage<V> message = attempt.getMessage();
    try {
      Instrumentation.instrument.returnVoidWithException(
          LOGGER,
          infra.scope(),
          infra.tracer(),
          () -> processor.process(message.getPayload()),
          MetricNames.PROCESS,
          StructuredLogging.KAFKA_TOPIC,
          message.getTopic(),
          StructuredLogging.KAFKA_PARTITION,
          Integer.toString(message.getPartition()));
    } catch (Exception e) {
      onProcessingFailure(attempt, permit, e);
      return;
    }
    attempt.transitionTo(MessageState.SUCCEEDED);
    metrics.incrementProcessed();
    resolve(attempt, permit);
  }

  private void onProcessingFailure(
      ProcessingAttempt<V> attempt, PartitionPermit permit, Exception e) {
    if (forceStopped.get() || isStale(attempt)) {
      abandon(attempt, permit);
      return;
    }
    InboundMessage<V> message = attempt.getMessage();
    if (e instanceof ValidationException) {
      metrics.incrementError("validation");
      LOGGER.warn(
          MetricNames.VALIDATION_FAILURE,
          StructuredLogging.kafkaTopic(message.getTopic()),
          StructuredLogging.kafkaPartition(message.getPartition()),
          StructuredLogging.kafkaOffset(message.getOffset()),
          StructuredLogging.recordId(recordId(message)),
          StructuredLogging.errorType(e));
      sendToDlq(attempt, permit, e, 0);
    } else if (e instanceof PermanentProcessingException) {
      metrics.incrementError("processing_permanent");
      sendToDlq(attempt, permit, e, attempt.getRetryCount());
    } else if (RetryScheduler.isRetryable(e) && attempt.getRetryCount() < maxRetries) {
      Duration delay = backoffPolicy.delay(attempt.getAttemptNumber());
      attempt.transitionTo(MessageState.RETRY_SCHEDULED);
      metrics.incrementRetry();
      LOGGER.warn(
          MetricNames.RETRY,
          StructuredLogging.kafkaTopic(message.getTopic()),
          StructuredLogging.kafkaPartition(message.getPartition()),
          StructuredLogging.kafkaOffset(message.getOffset()),
          StructuredLogging.recordId(recordId(message)),
          StructuredLogging.attempt(attempt.getAttemptNumber()),
          StructuredLogging.delayMs(delay.toMillis()),
          e);
      attempt.incrementAttempt();
      retryScheduler.scheduleRetry(attempt, delay, () -> resume(attempt, permit));
    } else {
      metrics.incrementError("processing");
      LOGGER.error(
          MetricNames.RETRIES_EXHAUSTED,
          StructuredLogging.kafkaTopic(message.getTopic()),
          StructuredLogging.kafkaPartition(message.getPartition()),
          StructuredLogging.kafkaOffset(message.getOffset()),
          StructuredLogging.recordId(recordId(message)),
          StructuredLogging.retryCount(attempt.getRetryCount()),
          e);
      sendToDlq(attempt, permit, e, attempt.getRetryCount());
    }
  }

  private void onUnexpectedFailure(
      ProcessingAttempt<V> attempt, PartitionPermit permit, Throwable t) {
    InboundMessage<V> message = attempt.getMessage();
    infra.scope().counter(MetricNames.UNEXPECTED_FAILURE).inc(1);
    LOGGER.error(
        MetricNames.UNEXPECTED_FAILURE,
        StructuredLogging.kafkaTopic(message.getTopic()),
        StructuredLogging.kafkaPartition(message.getPartition()),
        StructuredLogging.kafkaOffset(message.getOffset()),
        StructuredLogging.messageState(attempt.getState()),
        t);
    if (attempt.getState().isTerminal() || permit.isReleased()) {
      return;
    }
    if (forceStopped.get()) {
      abandon(attempt, permit);
      return;
    }
    metrics.incrementError("unexpected");
    try {
      sendToDlq(attempt, permit, t, 0);
    } catch (RuntimeException e) {
      LOGGER.error(
          MetricNames.UNEXPECTED_FAILURE,
          StructuredLogging.kafkaTopic(message.getTopic()),
          StructuredLogging.kafkaPartition(message.getPartition()),
          StructuredLogging.kafkaOffset(message.getOffset()),
          StructuredLogging.reason("dead letter routing failed"),
          e);
      block(attempt, permit, e);
    }
  }

  private void sendToDlq(
      ProcessingAttempt<V> attempt, PartitionPermit permit, Throwable failure, int retryCount) {
    attempt.transitionTo(MessageState.DLQ_PENDING);
    DlqOutcome outcome =
        dlqDispatcher.dispatch(
            DlqEnvelope.of(attempt.getMessage(), failure, retryCount, clock.instant()));
    switch (outcome) {
      case PUBLISHED:
      case FALLBACK:
        resolve(attempt, permit);
        break;
      case ABORTED:
        abandon(attempt, permit);
        break;
      case FAILED:
      default:
        block(attempt, permit, failure);
        break;
    }
  }

  /** Records the commit, then hands the partition to the next message. */
  private void resolve(ProcessingAttempt<V> attempt, PartitionPermit permit) {
    InboundMessage<V> message = attempt.getMessage();
    boolean committed = false;
    resolveLock.readLock().lock();
    try {
      if (!forceStopped.get()
          && !isStale(attempt)
          && attempt.transitionIfActive(MessageState.COMMITTED)) {
        commitCoordinator.recordResolved(
            message.topicPartition(), message.getOffset(), attempt.getAssignmentGeneration());
        committed = true;
      }
    } finally {
      resolveLock.readLock().unlock();
    }
    if (!committed) {
      abandon(attempt, permit);
      return;
    }
    unresolved.remove(attempt);
    permit.release();
  }

  // the partition was revoked, and possibly reassigned, after the message was received
  private boolean isStale(ProcessingAttempt<V> attempt) {
    return !commitCoordinator.isCurrent(
        attempt.getMessage().topicPartition(), attempt.getAssignmentGeneration());
  }

  private void abandon(ProcessingAttempt<V> attempt, @Nullable PartitionPermit permit) {
    if (attempt.transitionIfActive(MessageState.ABANDONED)) {
      InboundMessage<V> message = attempt.getMessage();
      infra.scope().counter(MetricNames.ABANDONED).inc(1);
      LOGGER.info(
          MetricNames.ABANDONED,
          StructuredLogging.kafkaTopic(message.getTopic()),
          StructuredLogging.kafkaPartition(message.getPartition()),
          StructuredLogging.kafkaOffset(message.getOffset()));
    }
    unresolved.remove(attempt);
    if (permit != null) {
      permit.release();
    }
  }

  private void block(ProcessingAttempt<V> attempt, PartitionPermit permit, Throwable failure) {
    InboundMessage<V> message = attempt.getMessage();
    TopicPartition tp = message.topicPartition();
    attempt.transitionIfActive(MessageState.BLOCKED);
    blocked.put(tp, permit);
    unresolved.remove(attempt);
    int dropped = sequencer.clear(tp);
    infra.scope().counter(MetricNames.DLQ_BLOCKED).inc(1);
    LOGGER.error(
        MetricNames.DLQ_BLOCKED,
        StructuredLogging.kafkaTopic(message.getTopic()),
        StructuredLogging.kafkaPartition(message.getPartition()),
        StructuredLogging.kafkaOffset(message.getOffset()),
        StructuredLogging.recordId(recordId(message)),
        StructuredLogging.errorType(failure),
        StructuredLogging.count(dropped));
  }

  private String recordId(InboundMessage<V> message) {
    try {
      return processor.getRecordId(message.getPayload());
    } catch (RuntimeException e) {
      return message.getTopic() + "-" + message.getPartition() + "@" + message.getOffset();
    }
  }

  /** Builder for {@link SequencedMessageConsumer}. */
  public static final class Builder<V> {
    @Nullable private ConsumerConfiguration config;
    @Nullable private MessageProcessor<V> processor;
    @Nullable private DlqPublisher<V> dlqPublisher;
    @Nullable private OffsetCommitCoordinator commitCoordinator;
    private DlqFallback<V> dlqFallback = new LoggingDlqFallback<>();
    private ConsumerMetrics metrics = ConsumerMetrics.NOOP;
    private CoreInfra infra = CoreInfra.NOOP;
    private Clock clock = Clock.systemUTC();
    @Nullable private PartitionSequencer sequencer;
    @Nullable private ProcessingExecutor executor;
    @Nullable private RetryScheduler retryScheduler;

    private Builder() {}

    public Builder<V> withConfiguration(ConsumerConfiguration config) {
      this.config = config;
      return this;
    }

    public Builder<V> withProcessor(MessageProcessor<V> processor) {
      this.processor = processor;
      return this;
    }

    public Builder<V> withDlqPublisher(DlqPublisher<V> dlqPublisher) {
      this.dlqPublisher = dlqPublisher;
      return this;
    }

    public Builder<V> withDlqFallback(DlqFallback<V> dlqFallback) {
      this.dlqFallback = dlqFallback;
      return this;
    }

    public Builder<V> withCommitCoordinator(OffsetCommitCoordinator commitCoordinator) {
      this.commitCoordinator = commitCoordinator;
      return this;
    }

    public Builder<V> withMetrics(ConsumerMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder<V> withInfra(CoreInfra infra) {
      this.infra = infra;
      return this;
    }

    public Builder<V> withClock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder<V> withSequencer(PartitionSequencer sequencer) {
      this.sequencer = sequencer;
      return this;
    }

    public Builder<V> withExecutor(ProcessingExecutor executor) {
      this.executor = executor;
      return this;
    }

    public Builder<V> withRetryScheduler(RetryScheduler retryScheduler) {
      this.retryScheduler = retryScheduler;
      return this;
    }

    public SequencedMessageConsumer<V> build() {
      Preconditions.checkNotNull(config, "configuration required");
      Preconditions.checkNotNull(processor, "processor required");
      Preconditions.checkNotNull(dlqPublisher, "dlq publisher required");
      Preconditions.checkNotNull(commitCoordinator, "commit coordinator required");
      config.validate();
      return new SequencedMessageConsumer<>(this);
    }
  }

  private static class MetricNames {
    static final String PROCESS = "consumer.process";
    static final String REJECTED = "consumer.message.rejected";
    static final String RETRY = "consumer.message.retry";
    static final String RETRIES_EXHAUSTED = "consumer.message.retries.exhausted";
    static final String VALIDATION_FAILURE = "consumer.message.validation.failure";
    static final String UNEXPECTED_FAILURE = "consumer.message.unexpected.failure";
    static final String ABANDONED = "consumer.message.abandoned";
    static final String DLQ_BLOCKED = "consumer.dlq.blocked";
    static final String SHUTDOWN_STARTED = "consumer.shutdown.started";
    static final String SHUTDOWN_COMPLETED = "consumer.shutdown.completed";
  }
}
