package io.openanomaly.tsdb;

import io.openanomaly.config.TsdbConfiguration;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.pipeline.Pipeline;
import java.net.http.HttpClient;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

public class PrometheusTsdbClientFactoryTest {
  private TsdbConfiguration config;
  private PrometheusTsdbClientFactory factory;

  @BeforeEach
  public void setup() {
    config = new TsdbConfiguration();
    config.setUrl("http://prometheus:9090/");
    factory =
        new PrometheusTsdbClientFactory(Mockito.mock(HttpClient.class), config, CoreInfra.NOOP);
  }

  private static Pipeline pipeline(String name) {
    Pipeline pipeline = new Pipeline();
    pipeline.setName(name);
    pipeline.setQuery("up");
    return pipeline;
  }

  @Test
  public void testDefaults() {
    PrometheusTsdbClient client = factory.get(pipeline("a"));
    Assertions.assertEquals("http://prometheus:9090", client.getReadUrl());
    Assertions.assertEquals("http://prometheus:9090/api/v1/write", client.getWriteUrl());
    // same endpoints, same client
    Assertions.assertSame(client, factory.get(pipeline("b")));
  }

  @Test
  public void testConfiguredWriteUrl() {
    config.setWriteUrl("http://mimir:9009/api/v1/push");
    PrometheusTsdbClient client = factory.get(pipeline("a"));
    Assertions.assertEquals("http://prometheus:9090", client.getReadUrl());
    Assertions.assertEquals("http://mimir:9009/api/v1/push", client.getWriteUrl());
  }

  @Test
  public void testPipelineOverrides() {
    Pipeline readOverride = pipeline("a");
    readOverride.setPrometheusUrl("http://other:9090");
    PrometheusTsdbClient client = factory.get(readOverride);
    Assertions.assertEquals("http://other:9090", client.getReadUrl());
    Assertions.assertEquals("http://other:9090/api/v1/write", client.getWriteUrl());

    Pipeline writeOverride = pipeline("b");
    writeOverride.setPrometheusUrl(" ");
    writeOverride.setPrometheusWriteUrl("http://sink:8080/write/");
    PrometheusTsdbClient other = factory.get(writeOverride);
    Assertions.assertEquals("http://prometheus:9090", other.getReadUrl());
    Assertions.assertEquals("http://sink:8080/write", other.getWriteUrl());
    Assertions.assertNotSame(client, other);
  }
}
