package com.bell.analyzer.storage;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Component
public class RedisMetricStore implements MetricStore {

  // one sample per score: a re-analyzed datapoint replaces the earlier member
  static final RedisScript<Long> REPLACE_AT_SCORE = RedisScript.of(
      "redis.call('ZREMRANGEBYSCORE', KEYS[1], ARGV[1], ARGV[1]) "
          + "return redis.call('ZADD', KEYS[1], ARGV[1], ARGV[2])",
      Long.class);

  private final StringRedisTemplate redis;

  public RedisMetricStore(StringRedisTemplate redis) {
    this.redis = redis;
  }

  @Override
  public String get(String hash, String field) {
    Object v = redis.opsForHash().get(hash, field);
    return v == null ? null : v.toString();
  }

  @Override
  public void set(String hash, String field, String value) {
    redis.opsForHash().put(hash, field, value);
  }

  @Override
  public List<String> rangeQuery(String key, double min, double max) {
    Set<String> members = redis.opsForZSet().rangeByScore(key, min, max);
    return members == null ? List.of() : new ArrayList<>(members);
  }

  @Override
  public void replace(String key, String member, double score) {
    redis.execute(REPLACE_AT_SCORE, List.of(key), scoreArg(score), member);
  }

  @Override
  public long deleteRange(String key, double min, double max) {
    Long removed = redis.opsForZSet().removeRangeByScore(key, min, max);
    return removed == null ? 0 : removed;
  }

  static String scoreArg(double score) {
    return BigDecimal.valueOf(score).stripTrailingZeros().toPlainString();
  }
}
