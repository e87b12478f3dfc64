package com.bell.analyzer.queue;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executor;

/** Kafka topic consumed by one consumer group; partitions give each worker exclusive jobs. */
@Component
@Profile("kafka-queue")
public class KafkaJobQueueFactory implements JobQueueFactory {

  private final ConsumerFactory<String, String> consumerFactory;
  private final String topic;
  private final String group;
  private final Duration pollTimeout;

  public KafkaJobQueueFactory(ConsumerFactory<String, String> consumerFactory,
                              @Value("${bell.queue.topic:bell-jobs}") String topic,
                              @Value("${bell.queue.group:bell-analyzers}") String group,
                              @Value("${bell.queue.block-timeout-ms:1000}") long pollTimeoutMs) {
    this.consumerFactory = consumerFactory;
    this.topic = topic;
    this.group = group;
    this.pollTimeout = Duration.ofMillis(pollTimeoutMs);
  }

  @Override
  public JobQueue open(String consumerName, Executor ioPool) {
    return new KafkaJobQueue(consumerFactory, topic, group, consumerName, pollTimeout);
  }
}
