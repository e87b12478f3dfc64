package com.bell.analyzer.queue;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executor;

/** Redis Stream with one consumer group shared by all analyzer workers. */
@Component
@Profile("!kafka-queue")
public class RedisStreamJobQueueFactory implements JobQueueFactory {

  private static final Logger log = LoggerFactory.getLogger(RedisStreamJobQueueFactory.class);

  private final StringRedisTemplate redis;
  private final String stream;
  private final String group;
  private final String payloadField;
  private final Duration blockTimeout;

  public RedisStreamJobQueueFactory(StringRedisTemplate redis,
                                    @Value("${bell.queue.stream:bell:jobs}") String stream,
                                    @Value("${bell.queue.group:bell-analyzers}") String group,
                                    @Value("${bell.queue.payload-field:payload}") String payloadField,
                                    @Value("${bell.queue.block-timeout-ms:1000}") long blockTimeoutMs) {
    this.redis = redis;
    this.stream = stream;
    this.group = group;
    this.payloadField = payloadField;
    this.blockTimeout = Duration.ofMillis(blockTimeoutMs);
  }

  @PostConstruct
  public void ensureGroup() {
    // XGROUP CREATE needs the stream to exist
    if (!Boolean.TRUE.equals(redis.hasKey(stream))) {
      redis.opsForStream().add(StreamRecords.mapBacked(Map.of("meta", "init")).withStreamKey(stream));
    }
    try {
      var groups = redis.opsForStream().groups(stream);
      boolean exists = groups.stream().anyMatch(g -> group.equals(g.groupName()));
      if (!exists) {
        redis.opsForStream().createGroup(stream, ReadOffset.from("0-0"), group);
        log.info("Created Redis Stream group '{}' on '{}' starting at 0-0", group, stream);
      } else {
        log.info("Redis Stream group '{}' already exists on '{}'", group, stream);
      }
    } catch (RuntimeException e) {
      String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      if (!msg.contains("BUSYGROUP")) throw e;
      log.info("Redis Stream group '{}' already exists on '{}' (BUSYGROUP)", group, stream);
    }
  }

  @Override
  public JobQueue open(String consumerName, Executor ioPool) {
    return new RedisStreamJobQueue(redis, stream, group, consumerName, payloadField, blockTimeout, ioPool);
  }
}
