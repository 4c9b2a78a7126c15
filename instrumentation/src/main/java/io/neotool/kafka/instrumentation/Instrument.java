package io.neotool.kafka.instrumentation;

import com.uber.m3.tally.Scope;
import io.opentracing.Tracer;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import org.slf4j.Logger;

/**
 * Instrument standardizes success/failure/latency logging, metrics and tracing around a single
 * consumer call such as processing a message, publishing to a dead letter topic or committing
 * offsets.
 *
 * <p>Tags are passed as varargs and interpreted as "key, value, key, value, ...".
 */
public interface Instrument {

  /**
   * WithException executes the provided supplier, uses the resultChecker to decide whether the
   * returned value counts as success, and rethrows any exception raised by the supplier.
   *
   * @param logger to invoke for writing logs.
   * @param scope for emitting metrics.
   * @param tracer to use for distributed tracing, may be null.
   * @param supplier is the closure that should be executed.
   * @param resultChecker returns true when the result is a success. If the checker itself throws,
   *     the result is treated as success.
   * @param name that is used to identify this call.
   * @param tags to add to logger/metrics/trace.
   * @param <T> the type to be returned.
   * @param <E> the type of the checked exception.
   * @return the value returned by the supplier.
   * @throws E which was thrown by the supplier.
   */
  <T, E extends Exception> T withException(
      Logger logger,
      Scope scope,
      @Nullable Tracer tracer,
      ThrowingSupplier<T, E> supplier,
      Function<T, Boolean> resultChecker,
      String name,
      String... tags)
      throws E;

  /**
   * WithException executes the provided supplier and rethrows any exception.
   *
   * <p>Usage:
   *
   * <pre>
   *   boolean published = Instrumentation.instrument.withException(
   *     LOGGER,
   *     scope,
   *     tracer,
   *     () -> publisher.publish(envelope),
   *     "consumer.dlq.publish",
   *     "kafka_topic",
   *     topic
   *   );
   * </pre>
   */
  default <T, E extends Exception> T withException(
      Logger logger,
      Scope scope,
      @Nullable Tracer tracer,
      ThrowingSupplier<T, E> supplier,
      String name,
      String... tags)
      throws E {
    return withException(logger, scope, tracer, supplier, r -> true, name, tags);
  }

  /**
   * ReturnVoidWithException executes the provided runnable and rethrows any exception.
   *
   * <p>This is syntactic sugar around {@code withException(..., ThrowingSupplier<Void> ...)}.
   */
  default <E extends Exception> void returnVoidWithException(
      Logger logger,
      Scope scope,
      @Nullable Tracer tracer,
      ThrowingRunnable<E> runnable,
      String name,
      String... tags)
      throws E {
    withException(
        logger,
        scope,
        tracer,
        () -> {
          runnable.run();
          return null;
        },
        name,
        tags);
  }

  /**
   * ReturnVoidCatchThrowable executes the provided runnable and catches anything it throws.
   *
   * <p>Use it for timer callbacks scheduled on a {@code ScheduledExecutorService}, where an escaped
   * exception would silently cancel all future executions. The failure is still logged and counted
   * by {@link #withException}.
   */
  default <E extends Exception> void returnVoidCatchThrowable(
      Logger logger, Scope scope, ThrowingRunnable<E> runnable, String name, String... tags) {
    try {
      returnVoidWithException(logger, scope, null, runnable, name, tags);
    } catch (Throwable t) {
      // already logged and counted by withException.
    }
  }

  /**
   * WithExceptionalCompletion executes the provided supplier and instruments the completion of the
   * returned stage.
   *
   * @param logger to invoke for writing logs.
   * @param scope for emitting metrics.
   * @param tracer to use for distributed tracing, may be null.
   * @param supplier is the closure that should be executed.
   * @param name that is used to identify this call.
   * @param tags to add to logger/metrics/trace.
   * @param <T> the type to be returned.
   * @return CompletionStage that is returned by the supplier.
   */
  <T> CompletionStage<T> withExceptionalCompletion(
      Logger logger,
      Scope scope,
      @Nullable Tracer tracer,
      Supplier<CompletionStage<T>> supplier,
      String name,
      String... tags);
}
