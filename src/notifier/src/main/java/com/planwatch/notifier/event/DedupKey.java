package com.planwatch.notifier.event;

/**
 * Identity of one pushed flight-plan occurrence: callsign, pilot and both airports.
 *
 * <p>Absent parts are normalized to empty strings so two events differing only in
 * {@code null} vs. missing attributes compare equal.
 */
public record DedupKey(String callsign, String pilotName, String departureAirport, String arrivalAirport) {

  public DedupKey {
    callsign = nullToEmpty(callsign);
    pilotName = nullToEmpty(pilotName);
    departureAirport = nullToEmpty(departureAirport);
    arrivalAirport = nullToEmpty(arrivalAirport);
  }

  public static DedupKey of(FlightEvent event) {
    return new DedupKey(
        event.callsign(), event.pilotName(), event.departureAirport(), event.arrivalAirport());
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  @Override
  public String toString() {
    return callsign + "_" + pilotName + "_" + departureAirport + "_" + arrivalAirport;
  }
}
