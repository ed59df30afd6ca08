package com.planwatch.notifier.dispatch;

import static org.assertj.core.api.Assertions.assertThat;

import com.planwatch.notifier.event.FlightEvent;
import com.planwatch.notifier.tenant.NotificationField;
import com.planwatch.notifier.tenant.TenantConfig;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NotificationRendererTest {
  private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

  private final NotificationRenderer renderer = new NotificationRenderer(Clock.fixed(NOW, ZoneOffset.UTC), null);

  @Test
  void rendersAllPresentFieldsWithDefaultAppearance() {
    FlightEvent event = new FlightEvent(
        "SWA10", "pilot_x", "B737", "IRFD", "ITKO", "350", "IFR", "GODLU DCT", null, Map.of());

    Notification notification = renderer.render(event, tenant(TenantConfig.Appearance.defaults()));

    assertThat(notification.title()).isEqualTo("✈️ New Flight Plan Filed");
    assertThat(notification.description()).isEqualTo("Flight **SWA10** has filed a flight plan");
    assertThat(notification.color()).isEqualTo(0x00FF00);
    assertThat(notification.footer()).isEqualTo("ATC24 Flight Plan Monitor");
    assertThat(notification.timestamp()).isEqualTo(NOW);
    assertThat(notification.fields()).containsExactly(
        new Notification.Field("Callsign", "**SWA10**", true),
        new Notification.Field("Pilot", "pilot_x", true),
        new Notification.Field("Aircraft", "B737", true),
        new Notification.Field("Departure", "IRFD", true),
        new Notification.Field("Arrival", "ITKO", true),
        new Notification.Field("Flight Level", "FL350", true),
        new Notification.Field("Flight Rules", "IFR", true),
        new Notification.Field("Route", "GODLU DCT", false));
  }

  @Test
  void absentRouteIsOmittedEvenWhenVisible() {
    FlightEvent event = new FlightEvent("UAL456", null, "B738", null, null, null, null, null, null, Map.of());

    Notification notification = renderer.render(event, tenant(TenantConfig.Appearance.defaults()));

    assertThat(notification.fields()).extracting(Notification.Field::name).containsExactly("Callsign", "Aircraft");
  }

  @Test
  void routePlaceholderCountsAsAbsent() {
    FlightEvent event = new FlightEvent("UAL456", null, null, null, null, null, null, "N/A", null, Map.of());

    assertThat(renderer.render(event, tenant(TenantConfig.Appearance.defaults())).fields())
        .extracting(Notification.Field::name)
        .doesNotContain("Route");
  }

  @Test
  void hiddenFieldsAndCustomAppearanceAreApplied() {
    TenantConfig.Appearance appearance = new TenantConfig.Appearance(
        0x3498DB,
        "Delta departures",
        "https://img.example/thumb.png",
        "https://img.example/banner.png",
        EnumSet.of(NotificationField.CALLSIGN, NotificationField.FLIGHT_LEVEL));
    FlightEvent event = new FlightEvent("DAL9", "p", "A321", "IRFD", "ITKO", "FL120", "VFR", null, null, Map.of());

    Notification notification = renderer.render(event, tenant(appearance));

    assertThat(notification.title()).isEqualTo("Delta departures");
    assertThat(notification.color()).isEqualTo(0x3498DB);
    assertThat(notification.thumbnailUrl()).isEqualTo("https://img.example/thumb.png");
    assertThat(notification.imageUrl()).isEqualTo("https://img.example/banner.png");
    assertThat(notification.fields()).containsExactly(
        new Notification.Field("Callsign", "**DAL9**", true),
        new Notification.Field("Flight Level", "FL120", true));
  }

  @Test
  void customFooterIsUsed() {
    NotificationRenderer custom = new NotificationRenderer(Clock.fixed(NOW, ZoneOffset.UTC), "Tower feed");

    assertThat(custom.render(FlightEvent.ofCallsign("A1"), tenant(null)).footer()).isEqualTo("Tower feed");
  }

  private static TenantConfig tenant(TenantConfig.Appearance appearance) {
    return new TenantConfig(1L, 100L, List.of("A"), appearance);
  }
}
