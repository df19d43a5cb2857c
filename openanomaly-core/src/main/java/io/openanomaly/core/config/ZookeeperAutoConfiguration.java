package io.openanomaly.core.config;

import io.openanomaly.core.common.StructuredLogging;
import io.openanomaly.core.common.ZKUtils;
import org.apache.curator.framework.CuratorFramework;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Provides the shared zookeeper client.
 *
 * <p>The client is lazy, so deployments whose backends are all local or redis never connect to
 * zookeeper.
 */
@Configuration
@EnableConfigurationProperties(ZookeeperConfiguration.class)
public class ZookeeperAutoConfiguration {
  private static final Logger logger = LoggerFactory.getLogger(ZookeeperAutoConfiguration.class);
  static final char ZK_PATH_SEPARATOR = '/';

  @Bean(destroyMethod = "close")
  @Lazy
  public CuratorFramework curatorFramework(ZookeeperConfiguration config) throws Exception {
    if (config.isAutoCreateRootNode()) {
      createRootNode(config);
    }
    CuratorFramework curatorFramework =
        ZKUtils.getCuratorFramework(
            config.getZkConnection(),
            (int) config.getSessionTimeout().toMillis(),
            (int) config.getConnectionTimeout().toMillis());
    ZKUtils.startIfLatent(curatorFramework);
    return curatorFramework;
  }

  // creates the chroot of the connection string, which the chrooted client can't do itself
  static void createRootNode(ZookeeperConfiguration config) throws Exception {
    String zkConnect = config.getZkConnection();
    int indexSeparator = zkConnect.indexOf(ZK_PATH_SEPARATOR);
    if (indexSeparator <= 0 || indexSeparator >= zkConnect.length() - 1) {
      // no chroot
      return;
    }
    String address = zkConnect.substring(0, indexSeparator);
    String rootNode = zkConnect.substring(indexSeparator);
    try (CuratorFramework client =
        ZKUtils.getCuratorFramework(
            address,
            (int) config.getSessionTimeout().toMillis(),
            (int) config.getConnectionTimeout().toMillis())) {
      client.start();
      ZKUtils.ensurePath(client, rootNode);
      logger.info("zookeeper.root.created", StructuredLogging.zkPath(rootNode));
    }
  }
}
