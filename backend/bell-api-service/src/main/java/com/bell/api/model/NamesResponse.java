package com.bell.api.model;

import java.util.List;

public record NamesResponse(List<MetricTrend> names, Meta meta) {
  public record Meta(String pattern, int limit, long matched) {}
}
