package io.openanomaly.core.registry;

import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.config.RegistryConfiguration;
import io.openanomaly.core.pipeline.ModelReferenceChecker;
import io.openanomaly.core.pipeline.PipelineCodec;
import io.openanomaly.core.pipeline.PipelineValidator;
import java.nio.file.Path;
import org.apache.curator.framework.CuratorFramework;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;
import org.springframework.beans.factory.ObjectProvider;

public class RegistryAutoConfigurationTest {
  @TempDir Path dir;
  private RegistryAutoConfiguration autoConfiguration;
  private RegistryConfiguration config;
  private PipelineCodec codec;
  private ObjectProvider<CuratorFramework> curatorProvider;

  @BeforeEach
  @SuppressWarnings("unchecked")
  public void setup() {
    autoConfiguration = new RegistryAutoConfiguration();
    config = new RegistryConfiguration();
    codec = new PipelineCodec(new PipelineValidator());
    curatorProvider = Mockito.mock(ObjectProvider.class);
    Mockito.when(curatorProvider.getObject()).thenReturn(Mockito.mock(CuratorFramework.class));
  }

  @Test
  @SuppressWarnings("unchecked")
  public void testValidatorUsesProvidedChecker() {
    ObjectProvider<ModelReferenceChecker> checker = Mockito.mock(ObjectProvider.class);
    Mockito.when(checker.getIfAvailable(Mockito.any())).thenReturn(ModelReferenceChecker.ANY);
    Assertions.assertNotNull(autoConfiguration.pipelineValidator(checker));
    Mockito.verify(checker).getIfAvailable(Mockito.any());
  }

  @Test
  public void testYamlRegistry() {
    config.setYamlPath(dir.resolve("pipelines.yaml").toString());
    Assertions.assertTrue(
        autoConfiguration.pipelineRegistry(config, codec, curatorProvider, CoreInfra.NOOP)
            instanceof YamlPipelineRegistry);
  }

  @Test
  public void testLocalRegistry() {
    config.setMode(RegistryMode.LOCAL);
    Assertions.assertTrue(
        autoConfiguration.pipelineRegistry(config, codec, curatorProvider, CoreInfra.NOOP)
            instanceof LocalPipelineRegistry);
  }

  @Test
  public void testZKRegistry() {
    config.setMode(RegistryMode.ZK);
    Assertions.assertTrue(
        autoConfiguration.pipelineRegistry(config, codec, curatorProvider, CoreInfra.NOOP)
            instanceof ZKPipelineRegistry);
    Mockito.verify(curatorProvider).getObject();
  }
}
