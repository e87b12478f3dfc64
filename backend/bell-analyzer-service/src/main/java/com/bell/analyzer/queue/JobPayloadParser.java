package com.bell.analyzer.queue;

import com.bell.protocol.Datapoint;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/** Reads the queue payload {@code [name, [time, value]]}. Numbers may also arrive as strings. */
public class JobPayloadParser {

  private final ObjectMapper mapper;

  public JobPayloadParser(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public Datapoint parse(byte[] body) {
    JsonNode root;
    try {
      root = mapper.readTree(body);
    } catch (IOException e) {
      throw new MalformedJobException("Job payload is not valid JSON", e);
    }
    if (root == null || !root.isArray() || root.size() != 2 || !root.get(0).isTextual()) {
      throw new MalformedJobException("Job payload must be [name, [time, value]]");
    }
    JsonNode point = root.get(1);
    if (!point.isArray() || point.size() != 2) {
      throw new MalformedJobException("Job payload must be [name, [time, value]]");
    }
    String name = root.get(0).asText();
    return Datapoint.of(name, (long) number(point.get(0), "time"), number(point.get(1), "value"));
  }

  private static double number(JsonNode node, String field) {
    double n;
    if (node.isNumber()) {
      n = node.asDouble();
    } else if (node.isTextual()) {
      try {
        n = Double.parseDouble(node.asText().trim());
      } catch (NumberFormatException e) {
        throw new MalformedJobException("Job field '" + field + "' is not a number: " + node.asText());
      }
    } else {
      throw new MalformedJobException("Job field '" + field + "' is not a number");
    }
    if (!Double.isFinite(n)) {
      throw new MalformedJobException("Job field '" + field + "' is not finite: " + node.asText());
    }
    return n;
  }
}
