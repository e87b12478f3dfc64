package com.bell.analyzer.worker;

import com.bell.analyzer.queue.Job;
import com.bell.analyzer.queue.JobPayloadParser;
import com.bell.analyzer.queue.JobQueue;
import com.bell.analyzer.queue.MalformedJobException;
import com.bell.protocol.Datapoint;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Reserve, analyze, delete, repeat. One job is in flight at a time. A job whose payload cannot
 * be read is logged and deleted. The loop ends when stopped or interrupted; any other failure
 * escapes {@link #run()} and ends this worker only.
 */
public class AnalysisWorker implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(AnalysisWorker.class);

  private final String name;
  private final JobQueue queue;
  private final JobPayloadParser parser;
  private final Analyzer analyzer;
  private final Counter jobs;
  private final Counter malformed;
  private final Timer duration;
  private volatile boolean running = true;

  public AnalysisWorker(String name, JobQueue queue, JobPayloadParser parser, Analyzer analyzer,
                        MeterRegistry metrics) {
    this.name = name;
    this.queue = queue;
    this.parser = parser;
    this.analyzer = analyzer;
    this.jobs = metrics.counter("bell_analyzer_jobs_total");
    this.malformed = metrics.counter("bell_analyzer_malformed_jobs_total");
    this.duration = metrics.timer("bell_analyzer_analysis_duration_seconds");
  }

  public String name() {
    return name;
  }

  @Override
  public void run() {
    log.info("worker {} started", name);
    try {
      while (running) {
        runOnce();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    log.info("worker {} stopped", name);
  }

  /** Handles exactly one job; {@code null} when it was discarded as malformed. */
  public AnalysisResult runOnce() throws InterruptedException {
    Job job = queue.reserve();
    Datapoint datapoint;
    try {
      datapoint = parser.parse(job.body());
    } catch (MalformedJobException e) {
      malformed.increment();
      log.warn("discarding malformed job {}: {}", job.id(), e.getMessage());
      queue.delete(job);
      return null;
    }

    long startAt = System.nanoTime();
    AnalysisResult result = analyzer.analyze(datapoint);
    long elapsed = System.nanoTime() - startAt;
    duration.record(elapsed, TimeUnit.NANOSECONDS);
    jobs.increment();
    log.info("{}ms analyzed {}: {}", TimeUnit.NANOSECONDS.toMillis(elapsed), result.name(), result.key());

    // not awaited; an unacknowledged job is left to the broker
    queue.delete(job);
    return result;
  }

  public boolean isRunning() {
    return running;
  }

  public void stop() {
    running = false;
  }
}
