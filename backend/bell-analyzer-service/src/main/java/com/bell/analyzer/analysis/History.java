package com.bell.analyzer.analysis;

/**
 * What the store knows about a metric at analysis time.
 *
 * @param trend last persisted trend, {@code NaN} if the metric has none yet
 * @param series reconstructed values, oldest first, live value last
 */
public record History(double trend, double[] series) {}
