package io.openanomaly.core.registry;

/** Mode determines the backend for the pipeline registry */
public enum RegistryMode {
  // LOCAL registry is in-memory.
  LOCAL,
  // YAML registry reads a pipeline document from disk and reloads it when it changes.
  YAML,
  // ZK is a zookeeper backed registry.
  ZK;

  public static final String METRICS_TAG = "registry_mode";
}
