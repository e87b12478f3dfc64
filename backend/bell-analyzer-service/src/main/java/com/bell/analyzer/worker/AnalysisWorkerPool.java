package com.bell.analyzer.worker;

import com.bell.analyzer.analysis.AnomalyDetector;
import com.bell.analyzer.analysis.PersistenceWriter;
import com.bell.analyzer.analysis.SeriesReconstructor;
import com.bell.analyzer.config.AnalyzerSettings;
import com.bell.analyzer.queue.JobPayloadParser;
import com.bell.analyzer.queue.JobQueue;
import com.bell.analyzer.queue.JobQueueFactory;
import com.bell.analyzer.storage.MetricStore;
import com.bell.analyzer.transport.AlertTransport;
import com.bell.protocol.AnomalyEventCodec;
import com.bell.protocol.storage.StorageLayout;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code bell.analyzer.workers} independent workers. Each one has its own thread, storage
 * pool, queue connection and alerter connection; they only share the store client and the
 * broker, which arbitrates job ownership.
 */
@Component
public class AnalysisWorkerPool {

  private static final Logger log = LoggerFactory.getLogger(AnalysisWorkerPool.class);

  private final AnalyzerSettings settings;
  private final MetricStore store;
  private final StorageLayout layout;
  private final AnomalyDetector detector;
  private final JobQueueFactory queues;
  private final AnomalyEventCodec codec;
  private final JobPayloadParser parser;
  private final MeterRegistry metrics;
  private final String alerterHost;
  private final int alerterPort;
  private final int connectTimeoutMs;
  private final String consumerId;

  private final List<Slot> slots = new ArrayList<>();

  public AnalysisWorkerPool(AnalyzerSettings settings,
                            MetricStore store,
                            StorageLayout layout,
                            AnomalyDetector detector,
                            JobQueueFactory queues,
                            AnomalyEventCodec codec,
                            ObjectMapper mapper,
                            MeterRegistry metrics,
                            @Value("${bell.alerter.host:127.0.0.1}") String alerterHost,
                            @Value("${bell.alerter.port:8389}") int alerterPort,
                            @Value("${bell.alerter.connect-timeout-ms:3000}") int connectTimeoutMs,
                            @Value("${bell.queue.consumer-id:}") String consumerId) {
    this.settings = settings;
    this.store = store;
    this.layout = layout;
    this.detector = detector;
    this.queues = queues;
    this.codec = codec;
    this.parser = new JobPayloadParser(mapper);
    this.metrics = metrics;
    this.alerterHost = alerterHost;
    this.alerterPort = alerterPort;
    this.connectTimeoutMs = connectTimeoutMs;
    this.consumerId = consumerId == null || consumerId.isBlank() ? defaultConsumerId() : consumerId;
  }

  // processes share the consumer group, so names must differ between them
  static String defaultConsumerId() {
    String host;
    try {
      host = InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      log.warn("cannot resolve local host name, using 'localhost': {}", e.getMessage());
      host = "localhost";
    }
    return host + "-" + ProcessHandle.current().pid();
  }

  @PostConstruct
  public synchronized void start() {
    for (int i = 0; i < settings.workers(); i++) {
      String name = "bell-analyzer-" + i;
      ExecutorService storagePool = Executors.newFixedThreadPool(
          settings.storageThreads(), new DefaultThreadFactory(name + "-storage", true));
      JobQueue queue = queues.open(consumerId + "-" + name, storagePool);
      AlertTransport transport = new AlertTransport(alerterHost, alerterPort, connectTimeoutMs, codec,
          new NioEventLoopGroup(1, new DefaultThreadFactory(name + "-alert", true)));

      Analyzer analyzer = new Analyzer(
          new SeriesReconstructor(store, layout, settings, storagePool),
          detector,
          new PersistenceWriter(store, layout, settings.expiration(), storagePool),
          transport,
          metrics);
      AnalysisWorker worker = new AnalysisWorker(name, queue, parser, analyzer, metrics);

      Slot slot = new Slot(worker, queue, transport, storagePool);
      Thread thread = new Thread(() -> runWorker(slot), name);
      slot.thread = thread;
      slots.add(slot);
      thread.start();
    }
    log.info("Started {} analyzer workers as {}, alerter at {}:{}", slots.size(), consumerId, alerterHost, alerterPort);
  }

  private void runWorker(Slot slot) {
    try {
      slot.worker.run();
    } catch (RuntimeException e) {
      if (slot.worker.isRunning()) {
        log.error("worker {} died: {}", slot.worker.name(), e.getMessage(), e);
      } else {
        log.debug("worker {} interrupted during shutdown: {}", slot.worker.name(), e.getMessage());
      }
    } finally {
      slot.release();
    }
  }

  @PreDestroy
  public synchronized void stop() {
    for (Slot slot : slots) {
      slot.worker.stop();
      slot.thread.interrupt();
    }
    for (Slot slot : slots) {
      try {
        slot.thread.join(TimeUnit.SECONDS.toMillis(5));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
    }
    slots.clear();
  }

  synchronized int liveWorkers() {
    int n = 0;
    for (Slot slot : slots) {
      if (slot.thread.isAlive()) n++;
    }
    return n;
  }

  private static final class Slot {
    final AnalysisWorker worker;
    final JobQueue queue;
    final AlertTransport transport;
    final ExecutorService storagePool;
    Thread thread;

    Slot(AnalysisWorker worker, JobQueue queue, AlertTransport transport, ExecutorService storagePool) {
      this.worker = worker;
      this.queue = queue;
      this.transport = transport;
      this.storagePool = storagePool;
    }

    void release() {
      try {
        queue.close();
      } catch (RuntimeException e) {
        log.warn("closing queue of {} failed: {}", worker.name(), e.getMessage());
      }
      transport.close();
      storagePool.shutdown();
    }
  }
}
