package io.openanomaly.core.controller.coordinator;

import com.google.common.annotations.VisibleForTesting;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.common.JsonSerializationFactory;
import io.openanomaly.core.common.StructuredLogging;
import io.openanomaly.core.common.ZKUtils;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;
import org.apache.curator.framework.CuratorFramework;
import org.apache.zookeeper.KeeperException;
import org.apache.zookeeper.data.Stat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ZKDistributedLock stores the lease record as JSON in a single persistent znode.
 *
 * <p>Every update is a compare-and-swap on the znode version, so concurrent acquire attempts are
 * resolved by zookeeper alone: the first write wins and the others see {@code BadVersion} or
 * {@code NodeExists}.
 *
 * <p>Expiry compares the record against this process' wall clock, so instances are assumed to
 * have clocks synchronized well within the lease safety margin.
 */
public final class ZKDistributedLock implements DistributedLock {
  private static final Logger logger = LoggerFactory.getLogger(ZKDistributedLock.class);

  private final CuratorFramework curatorFramework;
  private final String lockPath;
  private final Clock clock;
  private final CoreInfra infra;
  private final JsonSerializationFactory<Lease> serializer;
  private final AtomicBoolean running;

  public ZKDistributedLock(
      CuratorFramework curatorFramework, String lockPath, Clock clock, CoreInfra infra) {
    this.curatorFramework = curatorFramework;
    this.lockPath = lockPath;
    this.clock = clock;
    this.infra = infra;
    this.serializer = new JsonSerializationFactory<>(Lease.class);
    this.running = new AtomicBoolean(false);
  }

  @Override
  public void start() {
    ZKUtils.startIfLatent(curatorFramework);
    running.set(true);
  }

  @Override
  public void stop() {
    running.set(false);
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }

  @Override
  public LeaseGrant acquire(String holderId, Duration ttl) throws Exception {
    Stat stat = new Stat();
    Lease existing = read(stat);
    Instant now = clock.instant();
    if (existing == null) {
      Lease lease = new Lease(holderId, 1, now.plus(ttl));
      try {
        curatorFramework
            .create()
            .creatingParentContainersIfNeeded()
            .forPath(lockPath, serializer.serialize(lease));
      } catch (KeeperException.NodeExistsException e) {
        infra.scope().counter("lock.zk.acquire.conflict").inc(1);
        return LeaseGrant.denied(read(new Stat()));
      }
      return LeaseGrant.granted(lease);
    }
    if (!existing.isExpired(now)) {
      return LeaseGrant.denied(existing);
    }
    Lease lease = new Lease(holderId, existing.getFencingToken() + 1, now.plus(ttl));
    if (!compareAndSet(lease, stat.getVersion())) {
      infra.scope().counter("lock.zk.acquire.conflict").inc(1);
      return LeaseGrant.denied(read(new Stat()));
    }
    return LeaseGrant.granted(lease);
  }

  @Override
  public boolean renew(Lease lease, Duration ttl) throws Exception {
    Stat stat = new Stat();
    Lease existing = read(stat);
    Instant now = clock.instant();
    if (existing == null || !existing.sameTenure(lease) || existing.isExpired(now)) {
      return false;
    }
    return compareAndSet(existing.withExpiry(now.plus(ttl)), stat.getVersion());
  }

  @Override
  public void release(Lease lease) throws Exception {
    Stat stat = new Stat();
    Lease existing = read(stat);
    if (existing == null || !existing.sameTenure(lease)) {
      return;
    }
    if (compareAndSet(existing.withExpiry(clock.instant()), stat.getVersion())) {
      logger.info(
          "lock.zk.released",
          StructuredLogging.holderId(lease.getHolderId()),
          StructuredLogging.fencingToken(lease.getFencingToken()));
    }
  }

  @Override
  public Optional<Lease> current() throws Exception {
    return Optional.ofNullable(read(new Stat()));
  }

  @VisibleForTesting
  String getLockPath() {
    return lockPath;
  }

  @Nullable
  private Lease read(Stat stat) throws Exception {
    try {
      byte[] data = curatorFramework.getData().storingStatIn(stat).forPath(lockPath);
      return serializer.deserialize(data);
    } catch (KeeperException.NoNodeException e) {
      return null;
    }
  }

  private boolean compareAndSet(Lease lease, int expectedVersion) throws Exception {
    try {
      curatorFramework
          .setData()
          .withVersion(expectedVersion)
          .forPath(lockPath, serializer.serialize(lease));
      return true;
    } catch (KeeperException.BadVersionException | KeeperException.NoNodeException e) {
      return false;
    }
  }
}
