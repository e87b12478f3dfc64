package com.bell.analyzer.worker;

import com.bell.analyzer.analysis.AnomalyDetector;
import com.bell.analyzer.analysis.Deviation;
import com.bell.analyzer.analysis.Futures;
import com.bell.analyzer.analysis.History;
import com.bell.analyzer.analysis.PersistenceWriter;
import com.bell.analyzer.analysis.SeriesReconstructor;
import com.bell.analyzer.transport.AlertTransport;
import com.bell.protocol.AnomalyEvent;
import com.bell.protocol.Datapoint;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

/**
 * Analysis of one datapoint: rebuild history, score it, store the result and, for anomalies,
 * notify the alerter. A failed save is logged and does not stop the alert.
 */
public class Analyzer {

  private static final Logger log = LoggerFactory.getLogger(Analyzer.class);

  private final SeriesReconstructor reconstructor;
  private final AnomalyDetector detector;
  private final PersistenceWriter writer;
  private final AlertTransport transport;
  private final Counter anomalies;
  private final Counter saveFailures;

  public Analyzer(SeriesReconstructor reconstructor,
                  AnomalyDetector detector,
                  PersistenceWriter writer,
                  AlertTransport transport,
                  MeterRegistry metrics) {
    this.reconstructor = reconstructor;
    this.detector = detector;
    this.writer = writer;
    this.transport = transport;
    this.anomalies = metrics.counter("bell_analyzer_anomalies_total");
    this.saveFailures = metrics.counter("bell_analyzer_save_failures_total");
  }

  public AnalysisResult analyze(Datapoint datapoint) {
    String name = datapoint.name();

    History history = reconstructor.query(datapoint);
    Deviation deviation = detector.deviation(history.series());
    double multiple = deviation.multiple();
    double trend = detector.updateTrend(history.trend(), multiple);
    Datapoint analyzed = datapoint.withMultiple(multiple);

    String key = null;
    try {
      key = Futures.await(writer.save(analyzed, trend));
    } catch (DataAccessException e) {
      saveFailures.increment();
      log.error("failed to save {}: {}", name, e.getMessage());
    }

    boolean anomalous = detector.isAnomalous(multiple);
    if (anomalous) {
      anomalies.increment();
      transport.send(new AnomalyEvent(analyzed, trend, deviation.mean()));
    }
    return new AnalysisResult(name, key, multiple, anomalous);
  }
}
