package io.openanomaly.core.common;

import com.uber.m3.tally.Scope;
import io.opentracing.Tracer;
import io.opentracing.noop.NoopTracerFactory;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(MetricsConfiguration.class)
public class CoreInfraAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(Tracer.class)
  public Tracer defaultTracer() {
    return NoopTracerFactory.create();
  }

  @Bean
  @ConditionalOnMissingBean(Clock.class)
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public CoreInfra coreInfra(Scope scope, Tracer tracer) {
    return CoreInfra.builder().withScope(scope).withTracer(tracer).build();
  }
}
