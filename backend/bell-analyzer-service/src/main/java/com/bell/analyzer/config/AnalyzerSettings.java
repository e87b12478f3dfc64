package com.bell.analyzer.config;

/**
 * Deployment-fixed analyzer parameters. Times are in seconds.
 *
 * @param interval sampling interval, also the gap-fill step
 * @param filterOffset fraction of a period queried on each side of a historical anchor
 * @param periodicity distance between two historical anchors
 * @param expiration history horizon; older samples are pruned
 * @param trendingFactor smoothing factor of the trend, in (0, 1]
 * @param strict compare the last sample only instead of the mean of the last three
 * @param startSize minimum series length before a datapoint may be flagged
 */
public record AnalyzerSettings(
    long interval,
    double filterOffset,
    long periodicity,
    long expiration,
    double trendingFactor,
    boolean strict,
    int startSize,
    boolean fillBlankCounters,
    boolean fillBlankTimers,
    int workers,
    int storageThreads) {

  public AnalyzerSettings {
    if (interval <= 0) throw new IllegalArgumentException("interval must be positive");
    if (periodicity <= 0) throw new IllegalArgumentException("periodicity must be positive");
    if (expiration <= 0) throw new IllegalArgumentException("expiration must be positive");
    if (filterOffset < 0) throw new IllegalArgumentException("filterOffset must not be negative");
    if (!(trendingFactor > 0 && trendingFactor <= 1)) {
      throw new IllegalArgumentException("trendingFactor must be in (0, 1], got " + trendingFactor);
    }
    if (workers < 1) throw new IllegalArgumentException("workers must be at least 1");
    if (storageThreads < 1) throw new IllegalArgumentException("storageThreads must be at least 1");
  }

  /** Half width of each historical query window. */
  public double span() {
    return filterOffset * periodicity;
  }

  public boolean fillBlanks(String name) {
    if (name.startsWith("counter.")) return fillBlankCounters;
    if (name.startsWith("timer.")) return fillBlankTimers;
    return false;
  }
}
