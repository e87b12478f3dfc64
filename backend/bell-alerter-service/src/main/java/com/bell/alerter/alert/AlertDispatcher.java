package com.bell.alerter.alert;

import com.bell.protocol.AnomalyEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fans each received event out to the registered listeners. A failing listener is logged
 * and skipped so the others still see the event.
 */
@Component
public class AlertDispatcher {

  private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

  private final List<AlertListener> listeners;
  private final Counter received;

  @Autowired
  public AlertDispatcher(ObjectProvider<AlertListener> listeners, MeterRegistry metrics) {
    this(listeners.orderedStream().toList(), metrics);
  }

  public AlertDispatcher(List<AlertListener> listeners, MeterRegistry metrics) {
    this.listeners = List.copyOf(listeners);
    this.received = metrics.counter("bell_alerter_events_received_total");
    log.info("Alert listeners: {}", this.listeners.size());
  }

  public void dispatch(AnomalyEvent event) {
    received.increment();
    log.info("anomaly detected: {} at {} (multiple {}, trend {})",
        event.name(), event.time(), event.multiple(), event.trend());
    for (AlertListener listener : listeners) {
      try {
        listener.onAnomaly(event);
      } catch (RuntimeException e) {
        log.error("listener {} failed on {}: {}",
            listener.getClass().getSimpleName(), event.name(), e.getMessage(), e);
      }
    }
  }
}
