package io.neotool.kafka.consumer.executor;

import com.google.common.util.concurrent.Uninterruptibles;
import com.uber.m3.tally.Counter;
import com.uber.m3.tally.Scope;
import io.neotool.kafka.consumer.common.CoreInfra;
import io.neotool.kafka.consumer.config.ConsumerConfiguration;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;

public class ProcessingExecutorTest {
  private Scope scope;
  private Counter counter;
  private ProcessingExecutor executor;

  @BeforeEach
  public void setUp() {
    scope = Mockito.mock(Scope.class);
    counter = Mockito.mock(Counter.class);
    Mockito.when(scope.tagged(ArgumentMatchers.anyMap())).thenReturn(scope);
    Mockito.when(scope.counter(ArgumentMatchers.anyString())).thenReturn(counter);
    executor = new ProcessingExecutor(1, 1, CoreInfra.builder().withScope(scope).build());
  }

  @AfterEach
  public void tearDown() {
    if (!executor.isShutdown()) {
      executor.shutdown(Duration.ZERO);
    }
  }

  @Test
  public void testSubmitCallable() throws Exception {
    CompletableFuture<String> future = executor.submit(() -> "done");
    Assertions.assertEquals("done", future.get(5, TimeUnit.SECONDS));
  }

  @Test
  public void testSubmitRunnable() throws Exception {
    AtomicBoolean ran = new AtomicBoolean();
    Runnable task = () -> ran.set(true);
    executor.submit(task).get(5, TimeUnit.SECONDS);
    Assertions.assertTrue(ran.get());
    Assertions.assertEquals(0, executor.inFlightCount());
  }

  @Test
  public void testFailurePropagates() {
    Runnable task =
        () -> {
          throw new IllegalStateException("boom");
        };
    CompletableFuture<Void> future = executor.submit(task);
    ExecutionException e =
        Assertions.assertThrows(
            ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
    Assertions.assertTrue(e.getCause() instanceof IllegalStateException);
  }

  @Test
  public void testRejectsWhenSaturated() {
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch started = new CountDownLatch(1);
    Runnable blocking =
        () -> {
          started.countDown();
          Uninterruptibles.awaitUninterruptibly(release);
        };
    executor.submit(blocking);
    Uninterruptibles.awaitUninterruptibly(started);
    executor.submit(blocking);
    Assertions.assertEquals(2, executor.inFlightCount());
    Assertions.assertThrows(RejectedExecutionException.class, () -> executor.submit(blocking));
    Mockito.verify(scope).counter("consumer.executor.rejected");
    release.countDown();
  }

  @Test
  public void testShutdownDrainsWithinTimeout() throws Exception {
    AtomicInteger completed = new AtomicInteger();
    Runnable task =
        () -> {
          Uninterruptibles.sleepUninterruptibly(50, TimeUnit.MILLISECONDS);
          completed.incrementAndGet();
        };
    CompletableFuture<Void> first = executor.submit(task);
    CompletableFuture<Void> second = executor.submit(task);
    Assertions.assertEquals(0, executor.shutdown(Duration.ofSeconds(5)));
    Assertions.assertTrue(executor.isShutdown());
    Assertions.assertEquals(2, completed.get());
    first.get(1, TimeUnit.SECONDS);
    second.get(1, TimeUnit.SECONDS);
  }

  @Test
  public void testShutdownCancelsStragglers() {
    CountDownLatch started = new CountDownLatch(1);
    AtomicBoolean interrupted = new AtomicBoolean();
    Runnable task =
        () -> {
          started.countDown();
          try {
            Thread.sleep(TimeUnit.SECONDS.toMillis(30));
          } catch (InterruptedException e) {
            interrupted.set(true);
            Thread.currentThread().interrupt();
          }
        };
    CompletableFuture<Void> running = executor.submit(task);
    CompletableFuture<Void> queued = executor.submit(task);
    Uninterruptibles.awaitUninterruptibly(started);

    Assertions.assertEquals(2, executor.shutdown(Duration.ofMillis(50)));
    Assertions.assertThrows(CancellationException.class, running::join);
    Assertions.assertThrows(CancellationException.class, queued::join);
    Awaitility.await().atMost(5, TimeUnit.SECONDS).untilTrue(interrupted);
  }

  @Test
  public void testSubmitAfterShutdownIsRejected() {
    executor.shutdown(Duration.ZERO);
    Runnable task = () -> {};
    Assertions.assertThrows(RejectedExecutionException.class, () -> executor.submit(task));
  }

  @Test
  public void testOfConfiguration() throws Exception {
    ConsumerConfiguration config = new ConsumerConfiguration();
    config.setThreadPoolSize(2);
    config.setMaxQueuedTasks(4);
    ProcessingExecutor configured = ProcessingExecutor.of(config, CoreInfra.NOOP);
    try {
      Assertions.assertEquals(42, configured.submit(() -> 42).get(5, TimeUnit.SECONDS));
    } finally {
      configured.shutdown(Duration.ofSeconds(1));
    }
  }
}
