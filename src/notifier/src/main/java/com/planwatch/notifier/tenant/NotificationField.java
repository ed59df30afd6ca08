package com.planwatch.notifier.tenant;

/** Optional notification fields a tenant can show or hide, in rendering order. */
public enum NotificationField {
  CALLSIGN("Callsign", "show_callsign", true),
  PILOT("Pilot", "show_pilot", true),
  AIRCRAFT("Aircraft", "show_aircraft", true),
  DEPARTURE("Departure", "show_departure", true),
  ARRIVAL("Arrival", "show_arrival", true),
  FLIGHT_LEVEL("Flight Level", "show_flightlevel", true),
  FLIGHT_RULES("Flight Rules", "show_flightrules", true),
  ROUTE("Route", "show_route", false);

  private final String label;
  private final String column;
  private final boolean inline;

  NotificationField(String label, String column, boolean inline) {
    this.label = label;
    this.column = column;
    this.inline = inline;
  }

  public String label() {
    return label;
  }

  /** Visibility flag column in the tenant store. */
  public String column() {
    return column;
  }

  public boolean inline() {
    return inline;
  }
}
