package io.neotool.kafka.consumer.executor;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.neotool.kafka.consumer.common.CoreInfra;
import io.neotool.kafka.consumer.common.StructuredLogging;
import io.neotool.kafka.consumer.config.ConsumerConfiguration;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ProcessingExecutor is a bounded worker pool that runs processor invocations and DLQ publishing.
 *
 * <p>The queue is bounded: when both the workers and the queue are full, {@link #submit} throws
 * {@link RejectedExecutionException} and the caller decides how to back off. Every accepted task is
 * tracked until it completes so that {@link #shutdown(Duration)} can cancel stragglers.
 */
public class ProcessingExecutor {
  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessingExecutor.class);

  private final ThreadPoolExecutor executor;
  private final CoreInfra infra;
  private final Map<CompletableFuture<?>, Future<?>> inFlight = new ConcurrentHashMap<>();

  public ProcessingExecutor(int threadPoolSize, int maxQueuedTasks, CoreInfra infra) {
    Preconditions.checkArgument(threadPoolSize > 0, "threadPoolSize must be positive");
    Preconditions.checkArgument(maxQueuedTasks > 0, "maxQueuedTasks must be positive");
    this.infra = infra;
    this.executor =
        new ThreadPoolExecutor(
            threadPoolSize,
            threadPoolSize,
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(maxQueuedTasks),
            new ThreadFactoryBuilder()
                .setNameFormat("processing-worker-%d")
                .setDaemon(true)
                .build(),
            new ThreadPoolExecutor.AbortPolicy());
  }

  public static ProcessingExecutor of(ConsumerConfiguration config, CoreInfra infra) {
    return new ProcessingExecutor(config.getThreadPoolSize(), config.getMaxQueuedTasks(), infra);
  }

  /**
   * Submits a task.
   *
   * @return a future completed when the task finishes, or completed exceptionally with the task's
   *     failure or a {@link CancellationException} if the task was cancelled by shutdown.
   * @throws RejectedExecutionException if the pool is saturated or shut down.
   */
  public CompletableFuture<Void> submit(Runnable task) {
    return submit(
        () -> {
          task.run();
          return null;
        });
  }

  /** Submits a task returning a value. See {@link #submit(Runnable)}. */
  public <T> CompletableFuture<T> submit(Callable<T> task) {
    CompletableFuture<T> result = new CompletableFuture<>();
    Future<?> future;
    try {
      future =
          executor.submit(
              () -> {
                try {
                  result.complete(task.call());
                } catch (Throwable t) {
                  result.completeExceptionally(t);
                }
              });
    } catch (RejectedExecutionException e) {
      infra.scope().counter(MetricNames.REJECTED).inc(1);
      throw e;
    }
    inFlight.put(result, future);
    result.whenComplete((r, t) -> inFlight.remove(result));
    infra.scope().counter(MetricNames.SUBMITTED).inc(1);
    return result;
  }

  /** @return number of accepted tasks not yet completed. */
  public int inFlightCount() {
    return inFlight.size();
  }

  public boolean isShutdown() {
    return executor.isShutdown();
  }

  /**
   * Stops accepting tasks and waits up to {@code timeout} for accepted tasks to finish. Tasks still
   * running afterwards are interrupted and their futures complete with a cancellation.
   *
   * @return number of tasks cancelled because they did not finish in time.
   */
  public int shutdown(Duration timeout) {
    executor.shutdown();
    boolean terminated = false;
    try {
      terminated = executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    int cancelled = 0;
    if (!terminated) {
      for (Map.Entry<CompletableFuture<?>, Future<?>> entry : inFlight.entrySet()) {
        // complete first so that an interrupted task cannot complete the future itself
        if (entry.getKey().completeExceptionally(
            new CancellationException("processing executor shut down"))) {
          cancelled++;
        }
        entry.getValue().cancel(true);
      }
      executor.shutdownNow();
      infra.scope().counter(MetricNames.CANCELLED).inc(cancelled);
    }
    LOGGER.info(
        MetricNames.SHUTDOWN,
        StructuredLogging.timeoutMs(timeout.toMillis()),
        StructuredLogging.count(cancelled));
    return cancelled;
  }

  private static class MetricNames {
    static final String SUBMITTED = "consumer.executor.submitted";
    static final String REJECTED = "consumer.executor.rejected";
    static final String CANCELLED = "consumer.executor.cancelled";
    static final String SHUTDOWN = "consumer.executor.shutdown";
  }
}
