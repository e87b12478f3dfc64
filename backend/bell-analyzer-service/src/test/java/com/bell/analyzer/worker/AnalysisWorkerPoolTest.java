package com.bell.analyzer.worker;

import com.bell.analyzer.analysis.AnomalyDetector;
import com.bell.analyzer.config.AnalyzerSettings;
import com.bell.analyzer.queue.JobQueue;
import com.bell.analyzer.queue.JobQueueFactory;
import com.bell.analyzer.storage.MetricStore;
import com.bell.protocol.AnomalyEventCodec;
import com.bell.protocol.storage.StorageLayout;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.Answer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalysisWorkerPoolTest {

  private static final Answer<Object> BLOCK = inv -> {
    Thread.sleep(Long.MAX_VALUE);
    return null;
  };

  @Mock private MetricStore store;
  @Mock private JobQueueFactory queues;
  @Mock private JobQueue first;
  @Mock private JobQueue second;

  private AnalysisWorkerPool pool;

  @BeforeEach
  void setUp() {
    AnalyzerSettings settings = new AnalyzerSettings(10, 0.01, 86400, 604800, 0.1, true, 50, true, false, 2, 1);
    pool = new AnalysisWorkerPool(settings, store, new StorageLayout("bell."),
        new AnomalyDetector(true, 50, 0.1), queues, new AnomalyEventCodec(), new ObjectMapper(),
        new SimpleMeterRegistry(), "127.0.0.1", 1, 100, "host-a-42");
    lenient().when(queues.open(anyString(), any())).thenReturn(first, second);
  }

  @AfterEach
  void tearDown() {
    pool.stop();
  }

  @Test
  void eachWorkerGetsItsOwnQueueAndStopsCleanly() throws Exception {
    when(first.reserve()).thenAnswer(BLOCK);
    when(second.reserve()).thenAnswer(BLOCK);

    pool.start();

    verify(queues).open(eq("host-a-42-bell-analyzer-0"), any());
    verify(queues).open(eq("host-a-42-bell-analyzer-1"), any());
    verify(first, timeout(2000)).reserve();
    verify(second, timeout(2000)).reserve();
    assertEquals(2, pool.liveWorkers());

    pool.stop();

    verify(first).close();
    verify(second).close();
    assertEquals(0, pool.liveWorkers());
  }

  @Test
  void defaultConsumerIdNamesThisProcess() {
    String id = AnalysisWorkerPool.defaultConsumerId();
    assertTrue(id.endsWith("-" + ProcessHandle.current().pid()), id);
  }

  @Test
  void aDyingWorkerLeavesTheOthersRunning() throws Exception {
    when(first.reserve()).thenThrow(new IllegalStateException("broker gone"));
    when(second.reserve()).thenAnswer(BLOCK);

    pool.start();

    verify(first, timeout(2000)).close();
    verify(second, timeout(2000)).reserve();
    assertEquals(1, pool.liveWorkers());
  }
}
