package io.neotool.kafka.instrumentation;

import java.io.Closeable;
import javax.annotation.concurrent.Immutable;

/** NoopClosable stands in for a tracing scope when no span is active. */
@Immutable
final class NoopClosable implements Closeable {
  @Override
  public void close() {}
}
