package io.openanomaly.model;

import io.openanomaly.config.ModelConfiguration;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.common.CoreInfraAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Model engines for every role. The factory is also the registry's model reference checker, so
 * the scheduler and the ops CLI reject pipelines naming a backend this build does not have.
 */
@Configuration
@EnableConfigurationProperties(ModelConfiguration.class)
@Import(CoreInfraAutoConfiguration.class)
public class ModelEngineAutoConfiguration {

  @Bean
  public ModelEngineFactory modelEngineFactory(ModelConfiguration config, CoreInfra infra) {
    return new ModelEngineFactory(config, infra.subScope("model"));
  }
}
