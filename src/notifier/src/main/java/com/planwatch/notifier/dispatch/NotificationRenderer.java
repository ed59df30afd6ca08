package com.planwatch.notifier.dispatch;

import com.planwatch.notifier.config.NotifierProperties;
import com.planwatch.notifier.event.FlightEvent;
import com.planwatch.notifier.tenant.NotificationField;
import com.planwatch.notifier.tenant.TenantConfig;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Builds the per-tenant notification for an event.
 *
 * <p>A field is rendered only when the tenant shows it and the event carries a value for it.
 */
@Component
public class NotificationRenderer {
  public static final String DEFAULT_FOOTER = "ATC24 Flight Plan Monitor";
  private static final String ROUTE_PLACEHOLDER = "N/A";

  private final Clock clock;
  private final String footer;

  @Autowired
  public NotificationRenderer(NotifierProperties properties) {
    this(Clock.systemUTC(), properties.dispatch() == null ? null : properties.dispatch().footer());
  }

  public NotificationRenderer(Clock clock, String footer) {
    this.clock = clock;
    this.footer = footer == null || footer.isBlank() ? DEFAULT_FOOTER : footer;
  }

  public Notification render(FlightEvent event, TenantConfig config) {
    TenantConfig.Appearance appearance = config.appearance();
    List<Notification.Field> fields = new ArrayList<>();
    for (NotificationField field : NotificationField.values()) {
      if (!appearance.isVisible(field)) {
        continue;
      }
      String value = valueOf(field, event);
      if (value != null) {
        fields.add(new Notification.Field(field.label(), value, field.inline()));
      }
    }
    return new Notification(
        appearance.title(),
        "Flight **" + event.callsign() + "** has filed a flight plan",
        appearance.color(),
        appearance.thumbnailUrl(),
        appearance.imageUrl(),
        fields,
        footer,
        clock.instant());
  }

  private static String valueOf(NotificationField field, FlightEvent event) {
    return switch (field) {
      case CALLSIGN -> "**" + event.callsign() + "**";
      case PILOT -> event.pilotName();
      case AIRCRAFT -> event.aircraftType();
      case DEPARTURE -> event.departureAirport();
      case ARRIVAL -> event.arrivalAirport();
      case FLIGHT_LEVEL -> flightLevel(event.flightLevel());
      case FLIGHT_RULES -> event.flightRules();
      case ROUTE -> route(event.route());
    };
  }

  private static String route(String route) {
    return route == null || ROUTE_PLACEHOLDER.equalsIgnoreCase(route) ? null : route;
  }

  private static String flightLevel(String level) {
    if (level == null) {
      return null;
    }
    return level.toUpperCase(Locale.ROOT).startsWith("FL") ? level : "FL" + level;
  }
}
