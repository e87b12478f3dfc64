package com.bell.protocol;

import java.util.Objects;

/** An anomalous datapoint travelling from an analyzer worker to the alerter. */
public record AnomalyEvent(Datapoint datapoint, double trend, double mean) {

  public AnomalyEvent {
    Objects.requireNonNull(datapoint, "datapoint");
  }

  public String name() {
    return datapoint.name();
  }

  public long time() {
    return datapoint.time();
  }

  public double multiple() {
    return datapoint.multiple();
  }
}
