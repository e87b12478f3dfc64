package com.bell.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.io.IOException;

/** Alert frame body: {@code [[name, [time, value, multiple]], trend, mean]}. */
public final class AnomalyEventCodec {

  private final ObjectMapper mapper;

  public AnomalyEventCodec() {
    this(new ObjectMapper());
  }

  public AnomalyEventCodec(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public byte[] encode(AnomalyEvent event) {
    Datapoint dp = event.datapoint();
    ArrayNode root = mapper.createArrayNode();
    ArrayNode point = root.addArray();
    point.add(dp.name());
    point.addArray().add(dp.time()).add(dp.value()).add(dp.multiple());
    root.add(event.trend());
    root.add(event.mean());
    try {
      return mapper.writeValueAsBytes(root);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode anomaly event for " + dp.name(), e);
    }
  }

  public AnomalyEvent decode(byte[] body) {
    JsonNode root;
    try {
      root = mapper.readTree(body);
    } catch (IOException e) {
      throw new MalformedEventException("Alert frame is not valid JSON", e);
    }
    if (root == null || !root.isArray() || root.size() != 3) {
      throw new MalformedEventException("Alert frame must be [datapoint, trend, mean]");
    }
    JsonNode point = root.get(0);
    if (!point.isArray() || point.size() != 2 || !point.get(0).isTextual()) {
      throw new MalformedEventException("Datapoint must be [name, [time, value, multiple]]");
    }
    JsonNode values = point.get(1);
    if (!values.isArray() || values.size() != 3) {
      throw new MalformedEventException("Datapoint values must be [time, value, multiple]");
    }
    Datapoint dp = new Datapoint(
        point.get(0).asText(),
        requireNumber(values.get(0), "time").asLong(),
        requireNumber(values.get(1), "value").asDouble(),
        requireNumber(values.get(2), "multiple").asDouble());
    return new AnomalyEvent(dp,
        requireNumber(root.get(1), "trend").asDouble(),
        requireNumber(root.get(2), "mean").asDouble());
  }

  private static JsonNode requireNumber(JsonNode node, String field) {
    if (node == null || !node.isNumber()) {
      throw new MalformedEventException("Field '" + field + "' must be a number");
    }
    return node;
  }
}
