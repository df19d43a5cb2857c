package io.openanomaly.core.common;

import org.apache.curator.RetryPolicy;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.framework.imps.CuratorFrameworkState;
import org.apache.curator.retry.BoundedExponentialBackoffRetry;
import org.apache.zookeeper.KeeperException;

/** This class contains common utilities and defaults for using zk. */
public class ZKUtils {
  /** This is the noop ZK version * */
  public static final int NOOP_VERSION = -1;

  /** This is the default retry policy used for apache curator */
  public static final RetryPolicy DEFAULT_RETRY_POLICY =
      new BoundedExponentialBackoffRetry(1, 100, 5);

  private static final int DEFAULT_SESSION_TIMEOUT_MS =
      Integer.getInteger("curator-default-session-timeout", 60 * 1000);
  private static final int DEFAULT_CONNECTION_TIMEOUT_MS =
      Integer.getInteger("curator-default-connection-timeout", 15 * 1000);

  public static CuratorFramework getCuratorFramework(String zkConnection) {
    return getCuratorFramework(
        zkConnection, DEFAULT_SESSION_TIMEOUT_MS, DEFAULT_CONNECTION_TIMEOUT_MS);
  }

  public static CuratorFramework getCuratorFramework(
      String zkConnection, int sessionTimeoutMs, int connectionTimeoutMs) {
    return CuratorFrameworkFactory.builder()
        .connectString(zkConnection)
        .sessionTimeoutMs(sessionTimeoutMs)
        .connectionTimeoutMs(connectionTimeoutMs)
        .retryPolicy(ZKUtils.DEFAULT_RETRY_POLICY)
        .build();
  }

  /** Starts the client if it has not been started yet. */
  public static void startIfLatent(CuratorFramework curatorFramework) {
    if (curatorFramework.getState() == CuratorFrameworkState.LATENT) {
      curatorFramework.start();
    }
  }

  /** Creates the persistent path, including parents, if it doesn't exist. */
  public static void ensurePath(CuratorFramework curatorFramework, String path) throws Exception {
    if (curatorFramework.checkExists().forPath(path) != null) {
      return;
    }
    try {
      curatorFramework.create().creatingParentsIfNeeded().forPath(path);
    } catch (KeeperException.NodeExistsException e) {
      // created concurrently by another instance
    }
  }

  /** Joins a parent path and a child node name. */
  public static String join(String parent, String child) {
    return parent.endsWith("/") ? parent + child : parent + "/" + child;
  }
}
