package com.bell.analyzer.storage;

import java.util.List;

/** Failures surface as {@link org.springframework.dao.DataAccessException}. */
public interface MetricStore {

  String get(String hash, String field);

  void set(String hash, String field, String value);

  List<String> rangeQuery(String key, double min, double max);

  /** Makes {@code member} the only member scored {@code score}, in one atomic step. */
  void replace(String key, String member, double score);

  long deleteRange(String key, double min, double max);
}
