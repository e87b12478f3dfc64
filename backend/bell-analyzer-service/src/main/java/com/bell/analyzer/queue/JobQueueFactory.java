package com.bell.analyzer.queue;

import java.util.concurrent.Executor;

public interface JobQueueFactory {

  JobQueue open(String consumerName, Executor ioPool);
}
