package io.openanomaly.core.queue;

import com.google.common.annotations.VisibleForTesting;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.openanomaly.core.common.CoreInfra;
import io.openanomaly.core.common.JsonSerializationFactory;
import io.openanomaly.core.common.StructuredLogging;
import io.openanomaly.instrumentation.Instrumentation;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RedisJobQueue is a {@link JobQueue} shared through redis.
 *
 * <p>Layout, every key under the configured prefix:
 *
 * <ul>
 *   <li>{@code ready}: sorted set of job ids scored by the epoch millis they become visible.
 *   <li>{@code inflight}: sorted set of job ids scored by the epoch millis their delivery times
 *       out.
 *   <li>{@code jobs}: hash of job id to job json.
 *   <li>{@code keys} and {@code jobkeys}: hashes mapping idempotency key to job id and back.
 *   <li>{@code deliveries}: hash of job id to delivery count.
 *   <li>{@code fence}: highest fencing token seen.
 * </ul>
 *
 * Every state change is one Lua script, so it is atomic across all instances. Complete and requeue
 * compare the delivery count first, so a worker whose delivery timed out cannot settle the job
 * under a later delivery.
 */
public final class RedisJobQueue implements JobQueue {
  private static final Logger logger = LoggerFactory.getLogger(RedisJobQueue.class);

  // returns -1 on a stale token, 0 on a duplicate key, 1 when added
  @VisibleForTesting
  static final String ENQUEUE_SCRIPT =
      "local token = tonumber(ARGV[4])\n"
          + "if token > 0 then\n"
          + "  local fence = tonumber(redis.call('GET', KEYS[5]) or '0')\n"
          + "  if token < fence then return {-1, fence} end\n"
          + "  if token > fence then redis.call('SET', KEYS[5], ARGV[4]) end\n"
          + "end\n"
          + "if redis.call('HEXISTS', KEYS[3], ARGV[3]) == 1 then return {0, 0} end\n"
          + "redis.call('HSET', KEYS[2], ARGV[1], ARGV[2])\n"
          + "redis.call('HSET', KEYS[3], ARGV[3], ARGV[1])\n"
          + "redis.call('HSET', KEYS[4], ARGV[1], ARGV[3])\n"
          + "redis.call('ZADD', KEYS[1], ARGV[5], ARGV[1])\n"
          + "return {1, 0}\n";

  // moves timed out deliveries back to ready, then pops the first visible job
  @VisibleForTesting
  static final String CONSUME_SCRIPT =
      "local expired = redis.call('ZRANGEBYSCORE', KEYS[2], '-inf', ARGV[1])\n"
          + "for _, id in ipairs(expired) do\n"
          + "  redis.call('ZREM', KEYS[2], id)\n"
          + "  redis.call('ZADD', KEYS[1], ARGV[1], id)\n"
          + "end\n"
          + "local ids = redis.call('ZRANGEBYSCORE', KEYS[1], '-inf', ARGV[1], 'LIMIT', 0, 1)\n"
          + "if #ids == 0 then return {} end\n"
          + "local id = ids[1]\n"
          + "redis.call('ZREM', KEYS[1], id)\n"
          + "local body = redis.call('HGET', KEYS[3], id)\n"
          + "if not body then return {} end\n"
          + "redis.call('ZADD', KEYS[2], ARGV[2], id)\n"
          + "local count = redis.call('HINCRBY', KEYS[4], id, 1)\n"
          + "return {id, body, tostring(count)}\n";

  @VisibleForTesting
  static final String COMPLETE_SCRIPT =
      "local count = tonumber(redis.call('HGET', KEYS[5], ARGV[1]) or '0')\n"
          + "if count ~= tonumber(ARGV[2]) then return 0 end\n"
          + "local removed = redis.call('ZREM', KEYS[1], ARGV[1])\n"
          + "if removed == 0 then return 0 end\n"
          + "local key = redis.call('HGET', KEYS[4], ARGV[1])\n"
          + "if key then redis.call('HDEL', KEYS[3], key) end\n"
          + "redis.call('HDEL', KEYS[2], ARGV[1])\n"
          + "redis.call('HDEL', KEYS[4], ARGV[1])\n"
          + "redis.call('HDEL', KEYS[5], ARGV[1])\n"
          + "return 1\n";

  @VisibleForTesting
  static final String REQUEUE_SCRIPT =
      "local count = tonumber(redis.call('HGET', KEYS[3], ARGV[1]) or '0')\n"
          + "if count ~= tonumber(ARGV[3]) then return 0 end\n"
          + "if redis.call('ZREM', KEYS[1], ARGV[1]) == 0 then return 0 end\n"
          + "redis.call('ZADD', KEYS[2], ARGV[2], ARGV[1])\n"
          + "return 1\n";

  private final RedisCommands<String, String> commands;
  @Nullable private final StatefulRedisConnection<String, String> connection;
  @Nullable private final RedisClient client;
  private final String readyKey;
  private final String inflightKey;
  private final String jobsKey;
  private final String keysKey;
  private final String jobKeysKey;
  private final String deliveriesKey;
  private final String fenceKey;
  private final Clock clock;
  private final Duration visibilityTimeout;
  private final Duration pollInterval;
  private final JsonSerializationFactory<Job> serializer;
  private final CoreInfra infra;
  private final AtomicBoolean running = new AtomicBoolean(true);

  @VisibleForTesting
  RedisJobQueue(
      RedisCommands<String, String> commands,
      @Nullable StatefulRedisConnection<String, String> connection,
      @Nullable RedisClient client,
      String keyPrefix,
      Clock clock,
      Duration visibilityTimeout,
      Duration pollInterval,
      CoreInfra infra) {
    this.commands = commands;
    this.connection = connection;
    this.client = client;
    this.readyKey = keyPrefix + "ready";
    this.inflightKey = keyPrefix + "inflight";
    this.jobsKey = keyPrefix + "jobs";
    this.keysKey = keyPrefix + "keys";
    this.jobKeysKey = keyPrefix + "jobkeys";
    this.deliveriesKey = keyPrefix + "deliveries";
    this.fenceKey = keyPrefix + "fence";
    this.clock = clock;
    this.visibilityTimeout = visibilityTimeout;
    this.pollInterval = pollInterval;
    this.serializer = new JsonSerializationFactory<>(Job.class);
    this.infra = infra;
  }

  /** Connects to redis at the uri. */
  public static RedisJobQueue connect(
      String redisUri,
      Duration commandTimeout,
      String keyPrefix,
      Clock clock,
      Duration visibilityTimeout,
      Duration pollInterval,
      CoreInfra infra) {
    RedisURI uri = RedisURI.create(redisUri);
    uri.setTimeout(commandTimeout);
    RedisClient client = RedisClient.create(uri);
    StatefulRedisConnection<String, String> connection = client.connect();
    logger.info("redis.queue.connected", StructuredLogging.uri(uri.getHost()));
    return new RedisJobQueue(
        connection.sync(),
        connection,
        client,
        keyPrefix,
        clock,
        visibilityTimeout,
        pollInterval,
        infra);
  }

  @Override
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    if (connection != null) {
      connection.close();
    }
    if (client != null) {
      client.shutdown();
    }
    logger.info("redis.queue.closed");
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }

  @Override
  public boolean enqueue(Job job, Duration delay) throws Exception {
    List<Object> result =
        Instrumentation.instrument.withException(
            logger,
            infra.scope(),
            infra.tracer(),
            () ->
                commands.eval(
                    ENQUEUE_SCRIPT,
                    ScriptOutputType.MULTI,
                    new String[] {readyKey, jobsKey, keysKey, jobKeysKey, fenceKey},
                    job.getJobId(),
                    serializer.serializeToString(job),
                    job.getIdempotencyKey(),
                    Long.toString(job.getFencingToken()),
                    Long.toString(clock.millis() + delay.toMillis())),
            "redis.queue.enqueue");
    long outcome = (Long) result.get(0);
    if (outcome < 0) {
      throw new StaleFencingTokenException(job.getFencingToken(), (Long) result.get(1));
    }
    return outcome == 1;
  }

  @Override
  @Nullable
  public Delivery consume(Duration timeout) throws Exception {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (true) {
      Delivery delivery = tryConsume();
      if (delivery != null) {
        return delivery;
      }
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        return null;
      }
      Thread.sleep(Math.max(1, Math.min(pollInterval.toMillis(), remaining / 1_000_000)));
    }
  }

  @Nullable
  private Delivery tryConsume() throws IOException {
    long now = clock.millis();
    List<Object> result =
        commands.eval(
            CONSUME_SCRIPT,
            ScriptOutputType.MULTI,
            new String[] {readyKey, inflightKey, jobsKey, deliveriesKey},
            Long.toString(now),
            Long.toString(now + visibilityTimeout.toMillis()));
    if (result == null || result.isEmpty()) {
      return null;
    }
    Job job = serializer.deserialize((String) result.get(1));
    int deliveries = Integer.parseInt((String) result.get(2));
    return new Delivery(job, deliveries);
  }

  @Override
  public void complete(Delivery delivery) {
    commands.eval(
        COMPLETE_SCRIPT,
        ScriptOutputType.INTEGER,
        new String[] {inflightKey, jobsKey, keysKey, jobKeysKey, deliveriesKey},
        delivery.getJob().getJobId(),
        Integer.toString(delivery.getDeliveryCount()));
  }

  @Override
  public void fail(Delivery delivery, boolean requeue, Duration delay) {
    if (requeue) {
      commands.eval(
          REQUEUE_SCRIPT,
          ScriptOutputType.INTEGER,
          new String[] {inflightKey, readyKey, deliveriesKey},
          delivery.getJob().getJobId(),
          Long.toString(clock.millis() + delay.toMillis()),
          Integer.toString(delivery.getDeliveryCount()));
    } else {
      complete(delivery);
    }
  }

  @Override
  public long size() {
    return commands.hlen(jobsKey);
  }
}
