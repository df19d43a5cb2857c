package io.openanomaly.core.registry;

import com.google.common.collect.ImmutableMap;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.common.CoreInfraAutoConfiguration;
import io.openanomaly.core.config.RegistryConfiguration;
import io.openanomaly.core.config.ZookeeperAutoConfiguration;
import io.openanomaly.core.pipeline.ModelReferenceChecker;
import io.openanomaly.core.pipeline.PipelineCodec;
import io.openanomaly.core.pipeline.PipelineValidator;
import java.nio.file.Paths;
import org.apache.curator.framework.CuratorFramework;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * This is a factory for the pipeline registry.
 *
 * <p>The validator picks up a {@link ModelReferenceChecker} bean when the application provides
 * one, so model references are checked against the engines actually available.
 */
@Configuration
@EnableConfigurationProperties(RegistryConfiguration.class)
@Import({CoreInfraAutoConfiguration.class, ZookeeperAutoConfiguration.class})
public class RegistryAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public PipelineValidator pipelineValidator(ObjectProvider<ModelReferenceChecker> checker) {
    return new PipelineValidator(checker.getIfAvailable(() -> ModelReferenceChecker.ANY));
  }

  @Bean
  @ConditionalOnMissingBean
  public PipelineCodec pipelineCodec(PipelineValidator validator) {
    return new PipelineCodec(validator);
  }

  @Bean
  @ConditionalOnMissingBean
  public PipelineRegistry pipelineRegistry(
      RegistryConfiguration config,
      PipelineCodec codec,
      ObjectProvider<CuratorFramework> curatorFramework,
      CoreInfra infra) {
    CoreInfra registryInfra =
        infra.tagged(ImmutableMap.of(RegistryMode.METRICS_TAG, config.getMode().name()));
    switch (config.getMode()) {
      case LOCAL:
        return new LocalPipelineRegistry(codec.getValidator());
      case ZK:
        return new ZKPipelineRegistry(
            curatorFramework.getObject(), config.getZkPath(), codec, registryInfra);
      case YAML:
      default:
        return new YamlPipelineRegistry(Paths.get(config.getYamlPath()), codec, registryInfra);
    }
  }
}
