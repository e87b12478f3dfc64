package com.bell.analyzer.queue;

import com.bell.protocol.Datapoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class JobPayloadParserTest {

  private final JobPayloadParser parser = new JobPayloadParser(new ObjectMapper());

  @Test
  void readsNameTimeAndValue() {
    Datapoint dp = parse("[\"timer.api.latency\", [1699999999, 3.2]]");

    assertEquals("timer.api.latency", dp.name());
    assertEquals(1699999999L, dp.time());
    assertEquals(3.2, dp.value());
    assertFalse(dp.hasMultiple());
  }

  @Test
  void acceptsNumbersSentAsStrings() {
    Datapoint dp = parse("[\"counter.x\", [\"1699999999\", \"12\"]]");

    assertEquals(1699999999L, dp.time());
    assertEquals(12.0, dp.value());
  }

  @Test
  void rejectsOtherShapes() {
    assertThrows(MalformedJobException.class, () -> parse("[\"x\", 1, 2]"));
    assertThrows(MalformedJobException.class, () -> parse("[\"x\", [1]]"));
    assertThrows(MalformedJobException.class, () -> parse("[1, [1, 2]]"));
    assertThrows(MalformedJobException.class, () -> parse("[\"x\", [\"soon\", 2]]"));
    assertThrows(MalformedJobException.class, () -> parse("[\"x\", [1, null]]"));
    assertThrows(MalformedJobException.class, () -> parse("oops"));
  }

  @Test
  void rejectsNonFiniteNumbers() {
    assertThrows(MalformedJobException.class, () -> parse("[\"gauge.x\", [1000, 1e400]]"));
    assertThrows(MalformedJobException.class, () -> parse("[\"gauge.x\", [1000, \"NaN\"]]"));
    assertThrows(MalformedJobException.class, () -> parse("[\"gauge.x\", [1000, \"-Infinity\"]]"));
    assertThrows(MalformedJobException.class, () -> parse("[\"gauge.x\", [\"Infinity\", 1]]"));
  }

  private Datapoint parse(String json) {
    return parser.parse(json.getBytes(StandardCharsets.UTF_8));
  }
}
