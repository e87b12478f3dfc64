package com.bell.protocol.storage;

import com.bell.protocol.Datapoint;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StorageLayoutTest {

  @Test
  void keysCarryThePrefix() {
    StorageLayout layout = new StorageLayout("bell.");
    assertEquals("bell.counter.foo", layout.seriesKey("counter.foo"));
    assertEquals("bell.trend", layout.trendKey());
  }

  @Test
  void sampleMemberUsesFourDecimals() {
    Datapoint dp = new Datapoint("timer.x", 1699999999L, 3.2, 0.15);
    assertEquals("3.2000:0.1500:1699999999", StorageLayout.sampleMember(dp));
    assertEquals("0.0823:1699999999", StorageLayout.trendPayload(0.08231, 1699999999L));
  }

  @Test
  void parsesStoredMember() {
    StoredSample sample = StorageLayout.parseSample("-1.5000:0.2000:120");
    assertEquals(-1.5, sample.value());
    assertEquals(0.2, sample.multiple());
    assertEquals(120L, sample.time());
    assertThrows(IllegalArgumentException.class, () -> StorageLayout.parseSample("1:2"));
  }

  @Test
  void missingTrendIsNaN() {
    assertTrue(Double.isNaN(StorageLayout.parseTrend(null)));
    assertTrue(Double.isNaN(StorageLayout.parseTrend("garbage:1")));
    assertEquals(0.0823, StorageLayout.parseTrend("0.0823:1699999999"));
  }
}
