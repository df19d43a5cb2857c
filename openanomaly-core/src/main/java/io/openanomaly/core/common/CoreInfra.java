package io.openanomaly.core.common;

import com.uber.m3.tally.NoopScope;
import com.uber.m3.tally.Scope;
import io.opentracing.Tracer;
import io.opentracing.noop.NoopTracerFactory;
import java.util.Map;

/**
 * CoreInfra bundles the metrics scope and tracer handed to every scheduler, worker and task
 * component. Components derive a named sub scope for their own metrics.
 */
public class CoreInfra {

  /** Discards metrics and spans. Used by tests and the ops CLI. */
  public static final CoreInfra NOOP = CoreInfra.builder().build();

  private final Scope scope;
  private final Tracer tracer;

  private CoreInfra(Builder builder) {
    this.scope = builder.scope;
    this.tracer = builder.tracer;
  }

  public Scope scope() {
    return scope;
  }

  public Tracer tracer() {
    return tracer;
  }

  /** Returns infra whose metrics are prefixed with {@code name}. */
  public CoreInfra subScope(String name) {
    return CoreInfra.builder().withScope(scope.subScope(name)).withTracer(tracer).build();
  }

  /** Returns infra whose metrics carry the extra tags. */
  public CoreInfra tagged(Map<String, String> tags) {
    return CoreInfra.builder().withScope(scope.tagged(tags)).withTracer(tracer).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** The type Builder. */
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
