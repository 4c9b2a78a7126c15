package io.neotool.kafka.instrumentation;

import com.uber.m3.tally.Buckets;
import com.uber.m3.tally.DurationBuckets;
import com.uber.m3.tally.Scope;
import com.uber.m3.util.Duration;
import io.opentracing.Span;
import io.opentracing.Tracer;
import java.io.Closeable;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import net.logstash.logback.argument.StructuredArguments;
import org.slf4j.Logger;

/**
 * Instrumentation is the implementation of {@link Instrument} backed by SLF4J structured logging,
 * tally metrics and OpenTracing.
 *
 * <p>Logs:
 *
 * <ol>
 *   <li>Success: {message: "$name", "result": "success"} at debug level
 *   <li>Failure with a checked exception: {message: "$name", "result": "failure", "reason":
 *       "$exceptionSimpleName"} at warn level. Checked exceptions are business outcomes such as a
 *       payload that failed validation.
 *   <li>Failure with an unchecked exception or error: same fields at error level.
 * </ol>
 *
 * Metrics:
 *
 * <ol>
 *   <li>Counter: $name{result=success|failure, reason=exceptionSimpleName}
 *   <li>Latency histogram: $name.latency
 * </ol>
 *
 * <p>Tracing: a child span is created when the tracer has an active span.
 */
public enum Instrumentation implements Instrument {
  instrument;

  private static final Closeable NOOP_CLOSEABLE = new NoopClosable();
  private static final Buckets BUCKETS =
      new DurationBuckets(
          new Duration[] {
            Duration.ZERO,
            Duration.ofMillis(1),
            Duration.ofMillis(2),
            Duration.ofMillis(5),
            Duration.ofMillis(10),
            Duration.ofMillis(20),
            Duration.ofMillis(50),
            Duration.ofMillis(100),
            Duration.ofMillis(200),
            Duration.ofMillis(500),
            Duration.ofMillis(1000),
            Duration.ofMillis(2000),
            Duration.ofMillis(5000),
            Duration.ofSeconds(10),
            Duration.ofSeconds(30),
            Duration.ofSeconds(60)
          });

  @Override
  public <T, E extends Exception> T withException(
      Logger logger,
      Scope scope,
      @Nullable Tracer tracer,
      ThrowingSupplier<T, E> supplier,
      Function<T, Boolean> resultChecker,
      String name,
      String... tags)
      throws E {
    @Nullable Span span = tracer == null ? null : startSpan(tracer, tracer.activeSpan(), name);
    Closeable tracingScope = getTracingScope(tracer, span);
    long startNs = System.nanoTime();
    boolean isFailure = false;
    try {
      T t = supplier.get();
      try {
        if (!resultChecker.apply(t)) {
          isFailure = true;
          logAndMetricsResultFailure(logger, scope, System.nanoTime() - startNs, name, tags);
        }
      } catch (RuntimeException ignored) {
        // a throwing result checker counts as success.
      }
      return t;
    } catch (RuntimeException | Error e) {
      isFailure = true;
      logAndMetricsFailure(logger, scope, e, System.nanoTime() - startNs, name, tags);
      throw e;
    } catch (Exception ex) {
      isFailure = true;
      // supplier can only throw type E for checked exception so the cast is safe.
      @SuppressWarnings("unchecked")
      E e = (E) ex;
      logAndMetricsFailure(logger, scope, e, System.nanoTime() - startNs, name, tags);
      throw e;
    } finally {
      if (!isFailure) {
        logAndMetricsSuccess(logger, scope, System.nanoTime() - startNs, name, tags);
      }
      safeClose(tracingScope);
      if (span != null) {
        span.finish();
      }
    }
  }

  @Override
  public <T> CompletionStage<T> withExceptionalCompletion(
      Logger logger,
      Scope scope,
      @Nullable Tracer tracer,
      Supplier<CompletionStage<T>> supplier,
      String name,
      String... tags) {
    @Nullable Span span = tracer == null ? null : startSpan(tracer, tracer.activeSpan(), name);
    final Span immutableSpan = span;
    Closeable tracingScope = getTracingScope(tracer, span);
    long startNs = System.nanoTime();
    return supplier
        .get()
        .whenComplete(
            (r, t) -> {
              safeClose(tracingScope);
              if (immutableSpan != null) {
                immutableSpan.finish();
              }
              if (t != null) {
                logAndMetricsFailure(logger, scope, t, System.nanoTime() - startNs, name, tags);
              } else {
                logAndMetricsSuccess(logger, scope, System.nanoTime() - startNs, name, tags);
              }
            });
  }

  @Nullable
  private static Span startSpan(Tracer tracer, @Nullable Span parent, String name) {
    if (parent == null) {
      return null;
    }
    return tracer.buildSpan(name).asChildOf(parent).start();
  }

  /** The tracing scope must be closed after the span is finished. */
  private static Closeable getTracingScope(@Nullable Tracer tracer, @Nullable Span span) {
    if (tracer == null || span == null) {
      return NOOP_CLOSEABLE;
    }
    return tracer.scopeManager().activate(span);
  }

  private static void logAndMetricsResultFailure(
      Logger logger, Scope scope, long durationNs, String name, String... tags) {
    logger.warn(name, loggingTags(Tags.Value.failure, null, tags));
    reportCountAndLatency(
        scope.tagged(metricsTags(Tags.Value.failure, null, tags)), name, durationNs);
  }

  private static void logAndMetricsFailure(
      Logger logger,
      Scope scope,
      Throwable throwable,
      long durationNs,
      String name,
      String... tags) {
    Object[] fields = loggingTags(Tags.Value.failure, throwable, tags);
    if (throwable instanceof RuntimeException || throwable instanceof Error) {
      logger.error(name, fields);
    } else {
      logger.warn(name, fields);
    }
    reportCountAndLatency(
        scope.tagged(metricsTags(Tags.Value.failure, throwable, tags)), name, durationNs);
  }

  private static void logAndMetricsSuccess(
      Logger logger, Scope scope, long durationNs, String name, String... tags) {
    logger.debug(name, loggingTags(Tags.Value.success, null, tags));
    reportCountAndLatency(
        scope.tagged(metricsTags(Tags.Value.success, null, tags)), name, durationNs);
  }

  private static void reportCountAndLatency(Scope taggedScope, String name, long durationNs) {
    taggedScope.counter(name).inc(1);
    taggedScope.histogram(name + ".latency", BUCKETS).recordDuration(Duration.ofNanos(durationNs));
  }

  /**
   * Builds the metric tag map. The reason tag holds the simple class name of the throwable so that
   * metric cardinality stays bounded.
   */
  static Map<String, String> metricsTags(
      String resultValue, @Nullable Throwable throwable, String... tags) {
    Map<String, String> map = new HashMap<>();
    Utils.copyTags(map, tags);
    map.put(Tags.Key.result, resultValue);
    if (throwable != null) {
      map.put(Tags.Key.reason, throwable.getClass().getSimpleName());
    }
    return map;
  }

  /**
   * Builds the SLF4J argument array. Tags become StructuredArguments, the throwable (if any) is
   * appended last so that logback renders its stack trace.
   */
  static Object[] loggingTags(String resultValue, @Nullable Throwable throwable, String... tags) {
    int pairs = tags.length / 2;
    Object[] keyValues = new Object[pairs + 1 + (throwable == null ? 0 : 2)];
    int insertPosition = 0;
    for (int i = 0; i + 1 < tags.length; i += 2) {
      keyValues[insertPosition++] = StructuredArguments.keyValue(tags[i], tags[i + 1]);
    }
    keyValues[insertPosition++] = StructuredArguments.keyValue(Tags.Key.result, resultValue);
    if (throwable != null) {
      keyValues[insertPosition++] =
          StructuredArguments.keyValue(Tags.Key.reason, throwable.getClass().getSimpleName());
      keyValues[insertPosition] = throwable;
    }
    return keyValues;
  }

  /**
   * safeClose closes a tracing scope. Tracing scopes never throw IOException in practice.
   *
   * <p>VisibleForTesting.
   */
  static void safeClose(Closeable closeable) {
    try {
      closeable.close();
    } catch (IOException e) {
      // tracing scopes never throw.
    }
  }
}
