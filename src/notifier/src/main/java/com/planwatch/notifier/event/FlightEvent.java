package com.planwatch.notifier.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Normalized flight-plan / aircraft-spawn event, independent of the upstream transport.
 *
 * <p>Only {@code callsign} is required. Blank optional values are stored as {@code null} so a
 * missing field can never be rendered as an empty entry. Transport-specific attributes
 * (altitude, speed, ground speed, on-ground flag, ...) are kept in {@code extras}.
 */
public record FlightEvent(
    String callsign,
    String pilotName,
    String aircraftType,
    String departureAirport,
    String arrivalAirport,
    String flightLevel,
    String flightRules,
    String route,
    String realCallsign,
    Map<String, Object> extras) {

  public FlightEvent {
    if (callsign == null || callsign.isBlank()) {
      throw new IllegalArgumentException("callsign is required");
    }
    callsign = callsign.trim();
    pilotName = blankToNull(pilotName);
    aircraftType = blankToNull(aircraftType);
    departureAirport = blankToNull(departureAirport);
    arrivalAirport = blankToNull(arrivalAirport);
    flightLevel = blankToNull(flightLevel);
    flightRules = blankToNull(flightRules);
    route = blankToNull(route);
    realCallsign = blankToNull(realCallsign);
    extras = copyExtras(extras);
  }

  public static FlightEvent ofCallsign(String callsign) {
    return new FlightEvent(callsign, null, null, null, null, null, null, null, null, Map.of());
  }

  /** Callsign in the form used for prefix matching. */
  public String normalizedCallsign() {
    return callsign.toUpperCase(Locale.ROOT);
  }

  public DedupKey dedupKey() {
    return DedupKey.of(this);
  }

  private static String blankToNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }

  private static Map<String, Object> copyExtras(Map<String, Object> extras) {
    if (extras == null || extras.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    extras.forEach((key, value) -> {
      if (key != null && value != null) {
        copy.put(key, value);
      }
    });
    return Collections.unmodifiableMap(copy);
  }
}
