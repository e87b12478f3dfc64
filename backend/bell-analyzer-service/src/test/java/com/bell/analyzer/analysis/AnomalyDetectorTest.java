package com.bell.analyzer.analysis;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class AnomalyDetectorTest {

  private final AnomalyDetector strict = new AnomalyDetector(true, 5, 0.1);

  @Test
  void emptySeriesScoresZero() {
    Deviation d = strict.deviation(new double[0]);
    assertEquals(0, d.multiple());
    assertEquals(0, d.mean());
  }

  @Test
  void flatSeriesEndingOnTheMeanIsNotAnomalous() {
    double[] series = new double[10];
    Arrays.fill(series, 10);

    Deviation d = strict.deviation(series);

    assertEquals(0, d.multiple());
    assertEquals(10, d.mean());
  }

  @Test
  void flatSeriesScoresZeroInEitherMode() {
    AnomalyDetector lenient = new AnomalyDetector(false, 3, 0.1);
    Deviation d = lenient.deviation(new double[] {4, 4, 4, 4, 4, 4});
    assertEquals(0, d.multiple());
    assertEquals(4, d.mean());

    AnomalyDetector single = new AnomalyDetector(true, 1, 0.1);
    assertEquals(0, single.deviation(new double[] {7}).multiple());
  }

  @Test
  void shortSeriesNeverAlerts() {
    Deviation d = strict.deviation(new double[] {1, 1, 100});
    assertEquals(0, d.multiple());
    assertEquals(34, d.mean(), 1e-9);
  }

  @Test
  void singleSpikeAmongTenSitsOnTheThreeSigmaBoundary() {
    double[] series = {1, 1, 1, 1, 1, 1, 1, 1, 1, 50};

    Deviation d = strict.deviation(series);

    assertEquals(5.9, d.mean(), 1e-9);
    // population std is 14.7, so (50 - 5.9) / (3 * 14.7) = 1
    assertEquals(1.0, d.multiple(), 1e-9);
  }

  @Test
  void spikeAfterLongerHistoryIsAnomalous() {
    double[] series = {1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 50};

    Deviation d = strict.deviation(series);

    assertTrue(d.multiple() > 1, "multiple was " + d.multiple());
    assertTrue(strict.isAnomalous(d.multiple()));
  }

  @Test
  void nonStrictModeUsesMeanOfLastThree() {
    AnomalyDetector lenient = new AnomalyDetector(false, 5, 0.1);
    double[] series = {1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 50};

    double strictMultiple = strict.deviation(series).multiple();
    double lenientMultiple = lenient.deviation(series).multiple();

    assertTrue(lenientMultiple < strictMultiple);
    assertTrue(lenientMultiple > 0);
  }

  @Test
  void dropsAreNegative() {
    double[] series = {10, 10, 10, 10, 10, 10, 10, 10, 10, 10, 10, 10, 10, 10, 10, 0};
    double m = strict.deviation(series).multiple();
    assertTrue(m < -1);
    assertTrue(strict.isAnomalous(m));
  }

  @Test
  void trendBootstrapsFromFirstMultiple() {
    assertEquals(0.7, strict.updateTrend(Double.NaN, 0.7));
    assertEquals(-3.0, strict.updateTrend(Double.NaN, -3.0));
  }

  @Test
  void trendIsConvexCombination() {
    double[][] cases = {{0, 1}, {2, -2}, {-1, 3}};
    for (double[] c : cases) {
      double next = strict.updateTrend(c[0], c[1]);
      assertEquals(c[0] * 0.9 + c[1] * 0.1, next, 1e-12);
      assertTrue(next >= Math.min(c[0], c[1]) && next <= Math.max(c[0], c[1]));
    }
  }

  @Test
  void factorOfOneFollowsTheLatestMultiple() {
    AnomalyDetector follow = new AnomalyDetector(true, 5, 1.0);
    assertEquals(2.5, follow.updateTrend(-4, 2.5));
  }

  @Test
  void rejectsZeroFactor() {
    assertThrows(IllegalArgumentException.class, () -> new AnomalyDetector(true, 5, 0));
  }
}
