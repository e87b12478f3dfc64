package com.bell.analyzer.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RedisMetricStoreTest {

  @Mock private StringRedisTemplate redis;

  @Test
  void replaceRunsRemoveAndAddAsOneScript() {
    new RedisMetricStore(redis).replace("bell.counter.foo", "3.2000:0.1200:1700000000", 1_700_000_000);

    verify(redis).execute(eq(RedisMetricStore.REPLACE_AT_SCORE), eq(List.of("bell.counter.foo")),
        eq("1700000000"), eq("3.2000:0.1200:1700000000"));
  }

  @Test
  void scoreArgumentIsPlainDecimal() {
    assertEquals("1000", RedisMetricStore.scoreArg(1000));
    assertEquals("1700000000", RedisMetricStore.scoreArg(1.7e9));
    assertEquals("12.5", RedisMetricStore.scoreArg(12.5));
  }

  @Test
  void scriptRemovesTheScoreBeforeAdding() {
    String script = RedisMetricStore.REPLACE_AT_SCORE.getScriptAsString();
    assertTrue(script.indexOf("ZREMRANGEBYSCORE") < script.indexOf("ZADD"));
  }
}
