package com.planwatch.notifier.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwatch.notifier.event.FlightEventMapper;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Turns upstream payloads of varying shape into raw entity records.
 *
 * <p>Shapes are tried in a fixed order and anything unrecognized yields {@link Optional#empty()}
 * so the caller can skip the tick or drop the message.
 */
@Component
public class PayloadDecoder {
  /** Wrapper keys probed, in order, when a pushed payload is neither a list nor a record. */
  public static final List<String> WRAPPER_KEYS = List.of("flightPlan", "data", "flight_plan");

  /**
   * Decodes a full poll snapshot: an array of records, or an object keyed by callsign whose
   * values get the key injected as {@code callsign}.
   */
  public Optional<List<ObjectNode>> decodeSnapshot(JsonNode root) {
    if (root == null) {
      return Optional.empty();
    }
    if (root.isArray()) {
      return Optional.of(objectsOf(root));
    }
    if (root.isObject()) {
      List<ObjectNode> records = new ArrayList<>();
      Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
      while (entries.hasNext()) {
        Map.Entry<String, JsonNode> entry = entries.next();
        if (!entry.getValue().isObject()) {
          continue;
        }
        ObjectNode record = ((ObjectNode) entry.getValue()).deepCopy();
        record.put("callsign", entry.getKey());
        records.add(record);
      }
      return Optional.of(records);
    }
    return Optional.empty();
  }

  /**
   * Decodes the payload of one pushed message: an array of records, a single record, or a
   * wrapper object holding either under one of {@link #WRAPPER_KEYS}. Only the first wrapper key
   * present is considered.
   */
  public Optional<List<ObjectNode>> decodeMessage(JsonNode payload) {
    if (payload == null) {
      return Optional.empty();
    }
    List<ObjectNode> records = List.of();
    if (payload.isArray()) {
      records = objectsOf(payload);
    } else if (isRecord(payload)) {
      records = List.of((ObjectNode) payload);
    } else if (payload.isObject()) {
      for (String key : WRAPPER_KEYS) {
        JsonNode wrapped = payload.get(key);
        if (wrapped == null) {
          continue;
        }
        if (wrapped.isArray()) {
          records = objectsOf(wrapped);
        } else if (isRecord(wrapped)) {
          records = List.of((ObjectNode) wrapped);
        }
        break;
      }
    }
    return records.isEmpty() ? Optional.empty() : Optional.of(records);
  }

  private static boolean isRecord(JsonNode node) {
    return node.isObject() && FlightEventMapper.identifierOf(node).isPresent();
  }

  private static List<ObjectNode> objectsOf(JsonNode array) {
    List<ObjectNode> records = new ArrayList<>();
    for (JsonNode element : array) {
      if (element.isObject()) {
        records.add((ObjectNode) element);
      }
    }
    return records;
  }
}
