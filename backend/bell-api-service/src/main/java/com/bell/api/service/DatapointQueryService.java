package com.bell.api.service;

import com.bell.api.model.DatapointsResponse;
import com.bell.api.model.MetricTrend;
import com.bell.api.model.NamesResponse;
import com.bell.protocol.storage.StorageLayout;
import com.bell.protocol.storage.StoredSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/** Read side of the metric store, as written by the analyzer. */
@Service
public class DatapointQueryService {

  private static final Logger log = LoggerFactory.getLogger(DatapointQueryService.class);

  private final StringRedisTemplate redis;
  private final StorageLayout layout;

  public DatapointQueryService(StringRedisTemplate redis, StorageLayout layout) {
    this.redis = redis;
    this.layout = layout;
  }

  public DatapointsResponse datapoints(String name, long start, long stop) {
    Set<String> members = redis.opsForZSet().rangeByScore(layout.seriesKey(name), start, stop);
    List<Long> times = new ArrayList<>();
    List<Double> vals = new ArrayList<>();
    if (members != null) {
      for (String member : members) {
        StoredSample sample;
        try {
          sample = StorageLayout.parseSample(member);
        } catch (IllegalArgumentException e) {
          log.warn("skipping unreadable sample of {}: {}", name, e.getMessage());
          continue;
        }
        times.add(sample.time());
        vals.add(sample.multiple());
      }
    }
    Object payload = redis.opsForHash().get(layout.trendKey(), name);
    double trend = StorageLayout.parseTrend(payload == null ? null : payload.toString());
    return new DatapointsResponse(name, times, vals, Double.isNaN(trend) ? null : trend);
  }

  /** Analyzed metric names matching {@code pattern}, most trending (either direction) first. */
  public NamesResponse names(String pattern, int limit) {
    Pattern matcher = globToRegex(pattern);
    Map<Object, Object> entries = redis.opsForHash().entries(layout.trendKey());
    List<MetricTrend> matched = new ArrayList<>();
    for (Map.Entry<Object, Object> entry : entries.entrySet()) {
      String name = entry.getKey().toString();
      if (!matcher.matcher(name).matches()) {
        continue;
      }
      double trend = StorageLayout.parseTrend(entry.getValue() == null ? null : entry.getValue().toString());
      matched.add(new MetricTrend(name, Double.isNaN(trend) ? 0 : trend));
    }
    matched.sort(Comparator.comparingDouble((MetricTrend m) -> Math.abs(m.trend())).reversed()
        .thenComparing(MetricTrend::name));
    List<MetricTrend> page = matched.subList(0, Math.min(limit, matched.size()));
    return new NamesResponse(List.copyOf(page), new NamesResponse.Meta(pattern, limit, matched.size()));
  }

  /** {@code *} matches any run of characters; everything else is literal. Blank matches all. */
  static Pattern globToRegex(String glob) {
    if (glob == null || glob.isBlank()) {
      return Pattern.compile(".*", Pattern.DOTALL);
    }
    StringBuilder regex = new StringBuilder();
    int from = 0;
    for (int star = glob.indexOf('*'); star >= 0; star = glob.indexOf('*', from)) {
      if (star > from) {
        regex.append(Pattern.quote(glob.substring(from, star)));
      }
      regex.append(".*");
      from = star + 1;
    }
    if (from < glob.length()) {
      regex.append(Pattern.quote(glob.substring(from)));
    }
    return Pattern.compile(regex.toString(), Pattern.DOTALL);
  }
}
