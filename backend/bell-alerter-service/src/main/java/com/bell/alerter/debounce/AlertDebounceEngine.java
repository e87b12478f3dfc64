package com.bell.alerter.debounce;

import com.bell.alerter.alert.AlertListener;
import com.bell.protocol.AnomalyEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts consecutive anomalies per metric. Two anomalies are consecutive when the later one
 * is less than two intervals after the earlier. Once a run reaches the threshold every
 * further anomaly in it is notified.
 */
public class AlertDebounceEngine implements AlertListener {

  private static final Logger log = LoggerFactory.getLogger(AlertDebounceEngine.class);

  private final long interval;
  private final int threshold;
  private final Notifier notifier;
  private final ConcurrentHashMap<String, AlertRunState> runs = new ConcurrentHashMap<>();

  public AlertDebounceEngine(long interval, int threshold, Notifier notifier) {
    if (interval <= 0) {
      throw new IllegalArgumentException("interval must be positive: " + interval);
    }
    if (threshold < 1) {
      throw new IllegalArgumentException("threshold must be at least 1: " + threshold);
    }
    this.interval = interval;
    this.threshold = threshold;
    this.notifier = notifier;
  }

  @Override
  public void onAnomaly(AnomalyEvent event) {
    String name = event.name();
    long time = event.time();
    AlertRunState state = runs.compute(name, (key, prior) -> {
      int count = prior != null && prior.lastTime() > time - 2 * interval ? prior.count() + 1 : 1;
      return new AlertRunState(time, count);
    });
    log.debug("{} anomaly run at {}: {}", name, time, state.count());

    if (state.count() >= threshold) {
      try {
        notifier.publish(new Notification(name, state.count(), event.trend()));
      } catch (RuntimeException e) {
        log.error("notify {} failed: {}", name, e.getMessage(), e);
      }
    }
  }

  public Optional<AlertRunState> state(String name) {
    return Optional.ofNullable(runs.get(name));
  }
}
