package io.openanomaly.core.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "zookeeper")
public class ZookeeperConfiguration {
  private String zkConnection = "localhost:2181/openanomaly";
  private Duration sessionTimeout = Duration.ofSeconds(60);
  private Duration connectionTimeout = Duration.ofSeconds(15);
  // openanomaly can't start without the zookeeper root node. this enables auto creation of the
  // root node, which hides an accidental change of the root path, so enable it for tests only.
  private boolean autoCreateRootNode = false;

  public String getZkConnection() {
    return zkConnection;
  }

  public void setZkConnection(String zkConnection) {
    this.zkConnection = zkConnection;
  }

  public Duration getSessionTimeout() {
    return sessionTimeout;
  }

  public void setSessionTimeout(Duration sessionTimeout) {
    this.sessionTimeout = sessionTimeout;
  }

  public Duration getConnectionTimeout() {
    return connectionTimeout;
  }

  public void setConnectionTimeout(Duration connectionTimeout) {
    this.connectionTimeout = connectionTimeout;
  }

  public boolean isAutoCreateRootNode() {
    return autoCreateRootNode;
  }

  public void setAutoCreateRootNode(boolean autoCreateRootNode) {
    this.autoCreateRootNode = autoCreateRootNode;
  }
}
