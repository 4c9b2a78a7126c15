package io.neotool.kafka.instrumentation;

/**
 * ThrowingRunnable is a {@code Runnable} that may throw a checked exception.
 *
 * @param <E> checked exception that may be thrown.
 */
@FunctionalInterface
public interface ThrowingRunnable<E extends Exception> {
  void run() throws E;
}
