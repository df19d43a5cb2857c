package io.openanomaly.core.config;

import io.openanomaly.core.registry.RegistryMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Pipeline registry configurations. */
@ConfigurationProperties(prefix = "registry")
public class RegistryConfiguration {

  // Backend for the registry.
  private RegistryMode mode = RegistryMode.YAML;

  // Pipeline document read by the yaml registry. A .json suffix switches the document to json.
  private String yamlPath = "config/pipelines.yaml";

  // Root znode of the zookeeper registry.
  private String zkPath = "/registry";

  public RegistryMode getMode() {
    return mode;
  }

  public void setMode(RegistryMode mode) {
    this.mode = mode;
  }

  public String getYamlPath() {
    return yamlPath;
  }

  public void setYamlPath(String yamlPath) {
    this.yamlPath = yamlPath;
  }

  public String getZkPath() {
    return zkPath;
  }

  public void setZkPath(String zkPath) {
    this.zkPath = zkPath;
  }
}
