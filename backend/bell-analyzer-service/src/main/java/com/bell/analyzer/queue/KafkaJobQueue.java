package com.bell.analyzer.queue;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.ConsumerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;

/**
 * Reserve polls one record at a time; delete commits the offset past it. Both run on the
 * worker's thread, as the Kafka consumer requires.
 */
public class KafkaJobQueue implements JobQueue {

  private static final Logger log = LoggerFactory.getLogger(KafkaJobQueue.class);

  private final Consumer<String, String> consumer;
  private final String topic;
  private final Duration pollTimeout;
  private ConsumerRecord<String, String> reserved;

  public KafkaJobQueue(ConsumerFactory<String, String> consumerFactory, String topic, String group,
                       String consumerName, Duration pollTimeout) {
    Properties overrides = new Properties();
    overrides.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, "1");
    overrides.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
    this.consumer = consumerFactory.createConsumer(group, consumerName, null, overrides);
    this.consumer.subscribe(List.of(topic));
    this.topic = topic;
    this.pollTimeout = pollTimeout;
  }

  @Override
  public Job reserve() throws InterruptedException {
    while (true) {
      if (Thread.interrupted()) {
        throw new InterruptedException("Interrupted while reserving from " + topic);
      }
      ConsumerRecords<String, String> records = consumer.poll(pollTimeout);
      if (records.isEmpty()) {
        continue;
      }
      reserved = records.iterator().next();
      String body = reserved.value() == null ? "" : reserved.value();
      return new Job(jobId(reserved), body.getBytes(StandardCharsets.UTF_8));
    }
  }

  @Override
  public CompletableFuture<Void> delete(Job job) {
    CompletableFuture<Void> done = new CompletableFuture<>();
    if (reserved == null || !jobId(reserved).equals(job.id())) {
      done.completeExceptionally(new IllegalStateException("Job " + job.id() + " is not reserved here"));
      return done;
    }
    TopicPartition tp = new TopicPartition(reserved.topic(), reserved.partition());
    Map<TopicPartition, OffsetAndMetadata> offsets = Map.of(tp, new OffsetAndMetadata(reserved.offset() + 1));
    reserved = null;
    consumer.commitAsync(offsets, (committed, err) -> {
      if (err != null) {
        log.warn("Offset commit failed for job {}: {}", job.id(), err.getMessage());
        done.completeExceptionally(err);
      } else {
        done.complete(null);
      }
    });
    return done;
  }

  private static String jobId(ConsumerRecord<?, ?> record) {
    return record.topic() + "-" + record.partition() + "@" + record.offset();
  }

  @Override
  public void close() {
    consumer.close();
  }
}
