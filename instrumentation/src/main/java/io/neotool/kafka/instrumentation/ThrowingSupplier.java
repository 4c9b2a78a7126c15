package io.neotool.kafka.instrumentation;

/**
 * ThrowingSupplier is a {@code Supplier} that may throw a checked exception, for example a message
 * processor that raises a validation failure.
 *
 * @param <T> type to return.
 * @param <E> checked exception that may be thrown.
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {
  T get() throws E;
}
