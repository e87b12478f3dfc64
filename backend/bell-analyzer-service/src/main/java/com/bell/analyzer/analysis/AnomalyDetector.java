package com.bell.analyzer.analysis;

/** Deviation multiple is a third of the z-score, so beyond three sigma means |m| > 1. */
public class AnomalyDetector {

  private final boolean strict;
  private final int startSize;
  private final double trendingFactor;

  public AnomalyDetector(boolean strict, int startSize, double trendingFactor) {
    if (!(trendingFactor > 0 && trendingFactor <= 1)) {
      throw new IllegalArgumentException("trendingFactor must be in (0, 1], got " + trendingFactor);
    }
    this.strict = strict;
    this.startSize = startSize;
    this.trendingFactor = trendingFactor;
  }

  public Deviation deviation(double[] series) {
    int n = series.length;
    if (n == 0) return new Deviation(0, 0);

    double mean = mean(series, 0, n);
    double std = std(series, mean);

    if (n < startSize) return new Deviation(0, mean);

    // strict: the last sample; otherwise the mean of the last three
    double tail = strict ? series[n - 1] : mean(series, Math.max(0, n - 3), n);

    if (std == 0) {
      return new Deviation(tail == mean ? 0 : 1, mean);
    }
    return new Deviation((tail - mean) / (3 * std), mean);
  }

  public double updateTrend(double previous, double multiple) {
    if (Double.isNaN(previous)) {
      return multiple;
    }
    return previous * (1 - trendingFactor) + trendingFactor * multiple;
  }

  public boolean isAnomalous(double multiple) {
    return Math.abs(multiple) > 1;
  }

  private static double mean(double[] xs, int from, int to) {
    double sum = 0;
    for (int i = from; i < to; i++) sum += xs[i];
    return sum / (to - from);
  }

  // population standard deviation
  private static double std(double[] xs, double mean) {
    double var = 0;
    for (double x : xs) {
      double d = x - mean;
      var += d * d;
    }
    return Math.sqrt(var / xs.length);
  }
}
