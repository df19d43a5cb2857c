package io.openanomaly.core.worker;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.common.JsonSerializationFactory;
import io.openanomaly.core.common.StructuredLogging;
import io.openanomaly.core.common.ZKUtils;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;
import org.apache.curator.framework.CuratorFramework;
import org.apache.zookeeper.CreateMode;
import org.apache.zookeeper.KeeperException;
import org.apache.zookeeper.data.Stat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ZKResultLedger shares claims and commits between workers through zookeeper.
 *
 * <p>A claim is an ephemeral znode {@code <root>/claims/<key>}, so it disappears with the session
 * of a crashed worker, and also carries an expiry for a worker that hangs with a live session. A
 * commit is a persistent znode {@code <root>/committed/<hour>/<key>}, created in the same
 * transaction that deletes the claim. {@code <hour>} is the UTC hour of the job's due time, so no
 * listing grows with the retention and purging drops whole hours at once.
 */
public final class ZKResultLedger implements ResultLedger {
  private static final Logger logger = LoggerFactory.getLogger(ZKResultLedger.class);
  private static final String CLAIMS = "claims";
  private static final String COMMITTED = "committed";
  private static final DateTimeFormatter BUCKET_FORMAT =
      DateTimeFormatter.ofPattern("uuuuMMddHH").withZone(ZoneOffset.UTC);

  private final CuratorFramework curatorFramework;
  private final String claimsPath;
  private final String committedPath;
  private final Clock clock;
  private final CoreInfra infra;
  private final JsonSerializationFactory<Claim> serializer;
  private final AtomicBoolean running = new AtomicBoolean(false);

  public ZKResultLedger(
      CuratorFramework curatorFramework, String rootPath, Clock clock, CoreInfra infra) {
    this.curatorFramework = curatorFramework;
    this.claimsPath = ZKUtils.join(rootPath, CLAIMS);
    this.committedPath = ZKUtils.join(rootPath, COMMITTED);
    this.clock = clock;
    this.infra = infra;
    this.serializer = new JsonSerializationFactory<>(Claim.class);
  }

  @Override
  public void start() {
    ZKUtils.startIfLatent(curatorFramework);
    try {
      ZKUtils.ensurePath(curatorFramework, claimsPath);
      ZKUtils.ensurePath(curatorFramework, committedPath);
    } catch (Exception e) {
      logger.error("ledger.zk.path.create.failure", StructuredLogging.zkPath(claimsPath), e);
      throw new RuntimeException(e);
    }
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
  public ClaimResult claim(String idempotencyKey, Instant dueTime, String owner, Duration ttl)
      throws Exception {
    if (isCommitted(idempotencyKey, dueTime)) {
      return ClaimResult.ALREADY_COMMITTED;
    }
    String claimPath = ZKUtils.join(claimsPath, idempotencyKey);
    byte[] data = serializer.serialize(new Claim(owner, clock.instant().plus(ttl)));
    try {
      curatorFramework.create().withMode(CreateMode.EPHEMERAL).forPath(claimPath, data);
    } catch (KeeperException.NodeExistsException e) {
      Stat stat = new Stat();
      Claim existing = readClaim(claimPath, stat);
      if (existing != null
          && !existing.expiresAt.isBefore(clock.instant())
          && !existing.owner.equals(owner)) {
        return ClaimResult.IN_PROGRESS;
      }
      // the holder hung past its ttl; take the claim over if nobody else did first
      try {
        curatorFramework.delete().withVersion(stat.getVersion()).forPath(claimPath);
        curatorFramework.create().withMode(CreateMode.EPHEMERAL).forPath(claimPath, data);
        infra.scope().counter("ledger.zk.claim.takeover").inc(1);
      } catch (KeeperException.BadVersionException
          | KeeperException.NodeExistsException
          | KeeperException.NoNodeException raced) {
        return ClaimResult.IN_PROGRESS;
      }
    }
    // a commit may have landed between the check and the create
    if (isCommitted(idempotencyKey, dueTime)) {
      abandon(idempotencyKey, owner);
      return ClaimResult.ALREADY_COMMITTED;
    }
    return ClaimResult.CLAIMED;
  }

  @Override
  public void commit(String idempotencyKey, Instant dueTime, String owner) throws Exception {
    String claimPath = ZKUtils.join(claimsPath, idempotencyKey);
    Stat stat = new Stat();
    Claim existing = readClaim(claimPath, stat);
    if (existing == null || !existing.owner.equals(owner)) {
      throw new IllegalStateException("claim on " + idempotencyKey + " is not held by " + owner);
    }
    String bucketPath = bucketPath(dueTime);
    ZKUtils.ensurePath(curatorFramework, bucketPath);
    curatorFramework
        .transaction()
        .forOperations(
            curatorFramework
                .transactionOp()
                .create()
                .forPath(
                    ZKUtils.join(bucketPath, idempotencyKey),
                    clock.instant().toString().getBytes(StandardCharsets.UTF_8)),
            curatorFramework
                .transactionOp()
                .delete()
                .withVersion(stat.getVersion())
                .forPath(claimPath));
  }

  @Override
  public void abandon(String idempotencyKey, String owner) throws Exception {
    String claimPath = ZKUtils.join(claimsPath, idempotencyKey);
    Stat stat = new Stat();
    Claim existing = readClaim(claimPath, stat);
    if (existing == null || !existing.owner.equals(owner)) {
      return;
    }
    try {
      curatorFramework.delete().withVersion(stat.getVersion()).forPath(claimPath);
    } catch (KeeperException.BadVersionException | KeeperException.NoNodeException e) {
      // taken over or gone already
    }
  }

  @Override
  public boolean isCommitted(String idempotencyKey, Instant dueTime) throws Exception {
    return curatorFramework
            .checkExists()
            .forPath(ZKUtils.join(bucketPath(dueTime), idempotencyKey))
        != null;
  }

  @Override
  public int purge(Instant dueBefore) throws Exception {
    int purged = 0;
    for (String bucket : curatorFramework.getChildren().forPath(committedPath)) {
      Instant bucketEnd;
      try {
        bucketEnd = bucketStart(bucket).plus(Duration.ofHours(1));
      } catch (DateTimeParseException e) {
        logger.warn("ledger.zk.bucket.unknown", StructuredLogging.zkPath(bucket));
        continue;
      }
      if (bucketEnd.isAfter(dueBefore)) {
        continue;
      }
      String path = ZKUtils.join(committedPath, bucket);
      Stat stat = curatorFramework.checkExists().forPath(path);
      if (stat == null) {
        continue;
      }
      try {
        curatorFramework.delete().deletingChildrenIfNeeded().forPath(path);
        purged += stat.getNumChildren();
      } catch (KeeperException.NoNodeException e) {
        // purged concurrently by another worker
      }
    }
    if (purged > 0) {
      logger.info("ledger.zk.purged", StructuredLogging.count(purged));
    }
    return purged;
  }

  private String bucketPath(Instant dueTime) {
    return ZKUtils.join(committedPath, BUCKET_FORMAT.format(dueTime));
  }

  private static Instant bucketStart(String bucket) {
    return LocalDateTime.parse(bucket, BUCKET_FORMAT).toInstant(ZoneOffset.UTC);
  }

  @Nullable
  private Claim readClaim(String claimPath, Stat stat) throws Exception {
    try {
      return serializer.deserialize(
          curatorFramework.getData().storingStatIn(stat).forPath(claimPath));
    } catch (KeeperException.NoNodeException e) {
      return null;
    }
  }

  static final class Claim {
    final String owner;
    final Instant expiresAt;

    @JsonCreator
    Claim(@JsonProperty("owner") String owner, @JsonProperty("expires_at") Instant expiresAt) {
      this.owner = owner;
      this.expiresAt = expiresAt;
    }

    @JsonProperty("owner")
    public String getOwner() {
      return owner;
    }

    @JsonProperty("expires_at")
    public Instant getExpiresAt() {
      return expiresAt;
    }
  }
}
