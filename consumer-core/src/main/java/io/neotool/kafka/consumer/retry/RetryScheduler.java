package io.neotool.kafka.consumer.retry;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.neotool.kafka.consumer.common.CoreInfra;
import io.neotool.kafka.consumer.common.StructuredLogging;
import io.neotool.kafka.consumer.message.ProcessingAttempt;
import io.neotool.kafka.consumer.processor.PermanentProcessingException;
import io.neotool.kafka.consumer.processor.ValidationException;
import io.neotool.kafka.instrumentation.Instrumentation;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RetryScheduler holds retries in a delay queue ordered by due time and hands each one to its task
 * once due. No worker thread ever sleeps waiting for a retry.
 *
 * <p>Time is read from a Guava {@link Ticker}. With a timer, every scheduled retry also schedules
 * a wake-up that drains due retries. Without a timer (tests), due retries run only when {@link
 * #runDueRetries()} is called, which makes the backoff state machine deterministic under a fake
 * ticker.
 */
public class RetryScheduler implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(RetryScheduler.class);

  private final Ticker ticker;
  @Nullable private final ScheduledExecutorService timer;
  private final CoreInfra infra;
  private final AtomicLong sequence = new AtomicLong();
  private final PriorityBlockingQueue<ScheduledRetry> queue =
      new PriorityBlockingQueue<>(
          16,
          Comparator.comparingLong(ScheduledRetry::dueAtNanos)
              .thenComparingLong(r -> r.sequence));

  @VisibleForTesting
  RetryScheduler(Ticker ticker, @Nullable ScheduledExecutorService timer, CoreInfra infra) {
    this.ticker = ticker;
    this.timer = timer;
    this.infra = infra;
  }

  /** Creates a scheduler on the system clock with its own timer thread. */
  public static RetryScheduler create(CoreInfra infra) {
    return new RetryScheduler(
        Ticker.systemTicker(),
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("retry-scheduler-%d").setDaemon(true).build()),
        infra);
  }

  /** Creates a scheduler that only fires retries from {@link #runDueRetries()}. */
  @VisibleForTesting
  public static RetryScheduler manual(Ticker ticker, CoreInfra infra) {
    return new RetryScheduler(ticker, null, infra);
  }

  /**
   * Decides whether an error raised by a processor is worth another attempt.
   *
   * @return false for validation and permanent processing failures, true otherwise.
   */
  public static boolean isRetryable(Throwable error) {
    return !(error instanceof ValidationException || error instanceof PermanentProcessingException);
  }

  /**
   * Schedules the task to run once {@code runAfter} has elapsed.
   *
   * @param attempt the message being retried, for logging and introspection.
   * @param runAfter delay before the task becomes due.
   * @param task what to run when due. Runs on the timer thread, so it must only hand off work.
   * @return a handle that cancels the retry.
   */
  public RetryHandle scheduleRetry(ProcessingAttempt<?> attempt, Duration runAfter, Runnable task) {
    long delayNanos = Math.max(0, runAfter.toNanos());
    ScheduledRetry retry =
        new ScheduledRetry(
            attempt, task, ticker.read() + delayNanos, sequence.getAndIncrement());
    queue.add(retry);
    infra.scope().counter(MetricNames.SCHEDULED).inc(1);
    LOGGER.debug(
        MetricNames.SCHEDULED,
        StructuredLogging.kafkaTopic(attempt.getMessage().getTopic()),
        StructuredLogging.kafkaPartition(attempt.getMessage().getPartition()),
        StructuredLogging.kafkaOffset(attempt.getMessage().getOffset()),
        StructuredLogging.attempt(attempt.getAttemptNumber()),
        StructuredLogging.delayMs(runAfter.toMillis()));
    if (timer != null && !timer.isShutdown()) {
      timer.schedule(
          () ->
              Instrumentation.instrument.returnVoidCatchThrowable(
                  LOGGER, infra.scope(), this::runDueRetries, MetricNames.WAKEUP),
          delayNanos,
          TimeUnit.NANOSECONDS);
    }
    return retry;
  }

  /**
   * Hands every due, uncancelled retry to its task.
   *
   * @return number of retries fired.
   */
  public int runDueRetries() {
    int fired = 0;
    long now = ticker.read();
    while (true) {
      ScheduledRetry head = queue.peek();
      if (head == null || head.dueAtNanos > now) {
        return fired;
      }
      // another thread may have taken or cancelled the head meanwhile
      if (!queue.remove(head) || !head.state.compareAndSet(PENDING, FIRED)) {
        continue;
      }
      fired++;
      try {
        head.task.run();
        infra.scope().counter(MetricNames.FIRED).inc(1);
      } catch (RuntimeException e) {
        infra.scope().counter(MetricNames.TASK_FAILURE).inc(1);
        LOGGER.error(
            MetricNames.TASK_FAILURE,
            StructuredLogging.kafkaTopic(head.attempt.getMessage().getTopic()),
            StructuredLogging.kafkaPartition(head.attempt.getMessage().getPartition()),
            StructuredLogging.kafkaOffset(head.attempt.getMessage().getOffset()),
            e);
      }
    }
  }

  /** @return number of retries waiting to fire. */
  public int pendingCount() {
    return queue.size();
  }

  /** @return nanos until the earliest pending retry is due, or -1 when nothing is pending. */
  public long nanosUntilNextDue() {
    ScheduledRetry head = queue.peek();
    return head == null ? -1 : Math.max(0, head.dueAtNanos - ticker.read());
  }

  /**
   * Cancels every pending retry.
   *
   * @return the attempts whose retries were cancelled.
   */
  public List<ProcessingAttempt<?>> cancelAll() {
    List<ProcessingAttempt<?>> cancelled = new ArrayList<>();
    ScheduledRetry retry;
    while ((retry = queue.poll()) != null) {
      if (retry.cancel()) {
        cancelled.add(retry.attempt);
      }
    }
    if (!cancelled.isEmpty()) {
      infra.scope().counter(MetricNames.CANCELLED).inc(cancelled.size());
      LOGGER.info(MetricNames.CANCELLED, StructuredLogging.count(cancelled.size()));
    }
    return cancelled;
  }

  @Override
  public void close() {
    cancelAll();
    if (timer != null) {
      timer.shutdownNow();
    }
  }

  private static final int PENDING = 0;
  private static final int CANCELLED = 1;
  private static final int FIRED = 2;

  private final class ScheduledRetry implements RetryHandle {
    private final ProcessingAttempt<?> attempt;
    private final Runnable task;
    private final long dueAtNanos;
    private final long sequence;
    private final AtomicInteger state = new AtomicInteger(PENDING);

    ScheduledRetry(ProcessingAttempt<?> attempt, Runnable task, long dueAtNanos, long sequence) {
      this.attempt = attempt;
      this.task = task;
      this.dueAtNanos = dueAtNanos;
      this.sequence = sequence;
    }

    @Override
    public boolean cancel() {
      if (state.compareAndSet(PENDING, CANCELLED)) {
        queue.remove(this);
        return true;
      }
      return false;
    }

    @Override
    public boolean isCancelled() {
      return state.get() == CANCELLED;
    }

    @Override
    public boolean isFired() {
      return state.get() == FIRED;
    }

    @Override
    public long dueAtNanos() {
      return dueAtNanos;
    }
  }

  private static class MetricNames {
    static final String SCHEDULED = "consumer.retry.scheduled";
    static final String FIRED = "consumer.retry.fired";
    static final String CANCELLED = "consumer.retry.cancelled";
    static final String WAKEUP = "consumer.retry.wakeup";
    static final String TASK_FAILURE = "consumer.retry.task.failure";
  }
}
