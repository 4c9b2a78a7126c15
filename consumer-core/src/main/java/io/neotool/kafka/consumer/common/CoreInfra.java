package io.neotool.kafka.consumer.common;

import com.uber.m3.tally.NoopScope;
import com.uber.m3.tally.Scope;
import io.opentracing.Tracer;
import io.opentracing.noop.NoopTracerFactory;

/**
 * CoreInfra wraps the infrastructure objects that every consumer component needs: the metrics
 * scope and the tracer.
 *
 * <p>It keeps constructor signatures short.
 */
public class CoreInfra {

  /** The no operation infra instance */
  public static final CoreInfra NOOP = CoreInfra.builder().build();

  private final Scope scope;
  private final Tracer tracer;

  private CoreInfra(Builder builder) {
    this.scope = builder.scope;
    this.tracer = builder.tracer;
  }

  /**
   * Gets client for metrics emitting
   *
   * @return the scope
   */
  public Scope scope() {
    return scope;
  }

  /**
   * Gets client for tracing
   *
   * @return the tracer
   */
  public Tracer tracer() {
    return tracer;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private Scope scope = new NoopScope();
    private Tracer tracer = NoopTracerFactory.create();

    public Builder withScope(Scope scope) {
      this.scope = scope;
      return this;
    }

    public Builder withTracer(Tracer tracer) {
      this.tracer = tracer;
      return this;
    }

    public CoreInfra build() {
      return new CoreInfra(this);
    }
  }
}
