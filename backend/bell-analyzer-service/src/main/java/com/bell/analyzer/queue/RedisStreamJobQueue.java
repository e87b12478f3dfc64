package com.bell.analyzer.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Reserve is {@code XREADGROUP COUNT 1 BLOCK}, repeated until a record arrives; delete is
 * {@code XACK} followed by {@code XDEL}.
 */
public class RedisStreamJobQueue implements JobQueue {

  private static final Logger log = LoggerFactory.getLogger(RedisStreamJobQueue.class);

  private final StringRedisTemplate redis;
  private final String stream;
  private final String group;
  private final Consumer consumer;
  private final String payloadField;
  private final StreamReadOptions readOptions;
  private final Executor ioPool;

  public RedisStreamJobQueue(StringRedisTemplate redis, String stream, String group, String consumerName,
                             String payloadField, Duration blockTimeout, Executor ioPool) {
    this.redis = redis;
    this.stream = stream;
    this.group = group;
    this.consumer = Consumer.from(group, consumerName);
    this.payloadField = payloadField;
    this.readOptions = StreamReadOptions.empty().count(1).block(blockTimeout);
    this.ioPool = ioPool;
  }

  @Override
  public Job reserve() throws InterruptedException {
    while (true) {
      if (Thread.interrupted()) {
        throw new InterruptedException("Interrupted while reserving from " + stream);
      }
      List<MapRecord<String, Object, Object>> records = redis.opsForStream()
          .read(consumer, readOptions, StreamOffset.create(stream, ReadOffset.lastConsumed()));
      if (records == null || records.isEmpty()) {
        continue;
      }
      MapRecord<String, Object, Object> record = records.get(0);
      Object payload = record.getValue().get(payloadField);
      if (payload == null) {
        // group bootstrap entry or foreign record
        log.debug("Skipping stream record {} without '{}'", record.getId(), payloadField);
        remove(record.getId());
        continue;
      }
      return new Job(record.getId().getValue(), payload.toString().getBytes(StandardCharsets.UTF_8));
    }
  }

  @Override
  public CompletableFuture<Void> delete(Job job) {
    return CompletableFuture.runAsync(() -> remove(RecordId.of(job.id())), ioPool);
  }

  private void remove(RecordId id) {
    redis.opsForStream().acknowledge(stream, group, id);
    redis.opsForStream().delete(stream, id);
  }

  @Override
  public void close() {
    // connections belong to the shared factory
  }
}
