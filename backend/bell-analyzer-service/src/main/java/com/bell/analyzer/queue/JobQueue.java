package com.bell.analyzer.queue;

import java.util.concurrent.CompletableFuture;

/** One worker's connection to the shared work queue. */
public interface JobQueue extends AutoCloseable {

  Job reserve() throws InterruptedException;

  CompletableFuture<Void> delete(Job job);

  @Override
  void close();
}
