package com.planwatch.notifier.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps one raw upstream record (poll snapshot entity or pushed flight plan) to a {@link FlightEvent}.
 *
 * <p>The two upstream dialects name the same attributes differently, so every field is looked up
 * through an ordered alias list. Whatever is not consumed by a named field is carried in
 * {@link FlightEvent#extras()}.
 */
@Component
public class FlightEventMapper {
  private static final Logger log = LoggerFactory.getLogger(FlightEventMapper.class);

  /** Identifier fields, highest priority first. */
  public static final List<String> IDENTIFIER_FIELDS = List.of("callsign", "call_sign", "flight_id");

  private static final List<String> PILOT_FIELDS = List.of("robloxName", "playerName", "pilot", "pilotName");
  private static final List<String> AIRCRAFT_FIELDS = List.of("aircraft", "aircraftType");
  private static final List<String> DEPARTURE_FIELDS = List.of("departing", "departure", "departureAirport");
  private static final List<String> ARRIVAL_FIELDS = List.of("arriving", "arrival", "arrivalAirport");
  private static final List<String> FLIGHT_LEVEL_FIELDS = List.of("flightlevel", "flightLevel");
  private static final List<String> FLIGHT_RULES_FIELDS = List.of("flightrules", "flightRules");
  private static final List<String> ROUTE_FIELDS = List.of("route");
  private static final List<String> REAL_CALLSIGN_FIELDS = List.of("realcallsign", "realCallsign");

  private static final Set<String> NAMED_FIELDS = namedFields();

  private final ObjectMapper objectMapper;

  public FlightEventMapper(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Extracts the entity identifier using {@link #IDENTIFIER_FIELDS} in priority order.
   *
   * @param record raw upstream record
   * @return trimmed identifier, empty when none of the identifier fields holds a value
   */
  public static Optional<String> identifierOf(JsonNode record) {
    if (record == null || !record.isObject()) {
      return Optional.empty();
    }
    return Optional.ofNullable(firstText(record, IDENTIFIER_FIELDS));
  }

  /**
   * Converts a raw record. Records without an identifier are dropped.
   *
   * @param record raw upstream record
   * @return normalized event, empty when the record is not usable
   */
  public Optional<FlightEvent> fromRecord(JsonNode record) {
    Optional<String> callsign = identifierOf(record);
    if (callsign.isEmpty()) {
      log.debug("Dropping record without callsign: {}", record);
      return Optional.empty();
    }
    return Optional.of(new FlightEvent(
        callsign.get(),
        firstText(record, PILOT_FIELDS),
        firstText(record, AIRCRAFT_FIELDS),
        firstText(record, DEPARTURE_FIELDS),
        firstText(record, ARRIVAL_FIELDS),
        firstText(record, FLIGHT_LEVEL_FIELDS),
        firstText(record, FLIGHT_RULES_FIELDS),
        firstText(record, ROUTE_FIELDS),
        firstText(record, REAL_CALLSIGN_FIELDS),
        extras(record)));
  }

  private Map<String, Object> extras(JsonNode record) {
    Map<String, Object> extras = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (NAMED_FIELDS.contains(field.getKey()) || field.getValue().isNull()) {
        continue;
      }
      extras.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
    }
    return extras;
  }

  private static String firstText(JsonNode record, List<String> names) {
    for (String name : names) {
      JsonNode node = record.get(name);
      if (node == null || node.isNull() || !node.isValueNode()) {
        continue;
      }
      String text = node.asText().trim();
      if (!text.isEmpty()) {
        return text;
      }
    }
    return null;
  }

  private static Set<String> namedFields() {
    Set<String> names = new HashSet<>();
    names.addAll(IDENTIFIER_FIELDS);
    names.addAll(PILOT_FIELDS);
    names.addAll(AIRCRAFT_FIELDS);
    names.addAll(DEPARTURE_FIELDS);
    names.addAll(ARRIVAL_FIELDS);
    names.addAll(FLIGHT_LEVEL_FIELDS);
    names.addAll(FLIGHT_RULES_FIELDS);
    names.addAll(ROUTE_FIELDS);
    names.addAll(REAL_CALLSIGN_FIELDS);
    return Set.copyOf(names);
  }
}
