package com.bell.protocol.storage;

import com.bell.protocol.Datapoint;

import java.util.Locale;

// series: zset prefix+name, member value:multiple:time scored by time
// trends: hash prefix+"trend", field name, value trend:time
public final class StorageLayout {

  public static final String TREND_KEY = "trend";

  private final String prefix;

  public StorageLayout(String prefix) {
    this.prefix = prefix == null ? "" : prefix;
  }

  public String prefix() {
    return prefix;
  }

  public String seriesKey(String name) {
    return prefix + name;
  }

  public String trendKey() {
    return prefix + TREND_KEY;
  }

  public static String sampleMember(Datapoint dp) {
    return String.format(Locale.ROOT, "%.4f:%.4f:%d", dp.value(), dp.multiple(), dp.time());
  }

  public static StoredSample parseSample(String member) {
    String[] parts = member.split(":");
    if (parts.length != 3) {
      throw new IllegalArgumentException("Bad sample member: " + member);
    }
    try {
      return new StoredSample(
          Double.parseDouble(parts[0]),
          Double.parseDouble(parts[1]),
          (long) Double.parseDouble(parts[2]));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Bad sample member: " + member, e);
    }
  }

  public static String trendPayload(double trend, long time) {
    return String.format(Locale.ROOT, "%.4f:%d", trend, time);
  }

  // NaN when absent or unreadable
  public static double parseTrend(String payload) {
    if (payload == null || payload.isEmpty()) {
      return Double.NaN;
    }
    int sep = payload.indexOf(':');
    String head = sep < 0 ? payload : payload.substring(0, sep);
    try {
      return Double.parseDouble(head);
    } catch (NumberFormatException e) {
      return Double.NaN;
    }
  }
}
