package com.bell.protocol;

import java.util.Objects;

/**
 * One observation of a metric. {@code multiple} stays {@code NaN} until the analyzer has
 * computed the deviation for it.
 */
public record Datapoint(String name, long time, double value, double multiple) {

  public Datapoint {
    Objects.requireNonNull(name, "name");
  }

  public static Datapoint of(String name, long time, double value) {
    return new Datapoint(name, time, value, Double.NaN);
  }

  public Datapoint withMultiple(double multiple) {
    return new Datapoint(name, time, value, multiple);
  }

  public boolean hasMultiple() {
    return !Double.isNaN(multiple);
  }
}
