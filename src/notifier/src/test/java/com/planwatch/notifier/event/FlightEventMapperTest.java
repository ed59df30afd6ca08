package com.planwatch.notifier.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FlightEventMapperTest {
  private final ObjectMapper objectMapper = new ObjectMapper();
  private final FlightEventMapper mapper = new FlightEventMapper(objectMapper);

  @Test
  void mapsPushedFlightPlanFields() throws Exception {
    Optional<FlightEvent> event = mapper.fromRecord(objectMapper.readTree("""
        {
          "callsign": "SWA10",
          "realcallsign": "Southwest 10",
          "robloxName": "pilot_x",
          "aircraft": "B737",
          "departing": "IRFD",
          "arriving": "ITKO",
          "flightlevel": "350",
          "flightrules": "IFR",
          "route": "GODLU DCT"
        }
        """));

    assertThat(event).isPresent();
    FlightEvent flight = event.get();
    assertThat(flight.callsign()).isEqualTo("SWA10");
    assertThat(flight.realCallsign()).isEqualTo("Southwest 10");
    assertThat(flight.pilotName()).isEqualTo("pilot_x");
    assertThat(flight.aircraftType()).isEqualTo("B737");
    assertThat(flight.departureAirport()).isEqualTo("IRFD");
    assertThat(flight.arrivalAirport()).isEqualTo("ITKO");
    assertThat(flight.flightLevel()).isEqualTo("350");
    assertThat(flight.flightRules()).isEqualTo("IFR");
    assertThat(flight.route()).isEqualTo("GODLU DCT");
    assertThat(flight.extras()).isEmpty();
  }

  @Test
  void mapsSnapshotEntityAndKeepsTransportAttributesAsExtras() throws Exception {
    Optional<FlightEvent> event = mapper.fromRecord(objectMapper.readTree("""
        {"callsign": "DAL123", "playerName": "p1", "aircraftType": "B738",
         "altitude": 3200, "speed": 250.5, "groundSpeed": 240, "isOnGround": false, "heading": null}
        """));

    assertThat(event).isPresent();
    assertThat(event.get().pilotName()).isEqualTo("p1");
    assertThat(event.get().aircraftType()).isEqualTo("B738");
    assertThat(event.get().extras())
        .containsEntry("altitude", 3200)
        .containsEntry("speed", 250.5)
        .containsEntry("groundSpeed", 240)
        .containsEntry("isOnGround", false)
        .doesNotContainKey("heading");
  }

  @Test
  void identifierFollowsFieldPriority() throws Exception {
    assertThat(FlightEventMapper.identifierOf(objectMapper.readTree("{\"flight_id\":\"F1\",\"call_sign\":\"C1\"}")))
        .contains("C1");
    assertThat(FlightEventMapper.identifierOf(objectMapper.readTree("{\"flight_id\":\"F1\"}")))
        .contains("F1");
    assertThat(FlightEventMapper.identifierOf(objectMapper.readTree("{\"callsign\":\"  \",\"flight_id\":\"F1\"}")))
        .contains("F1");
  }

  @Test
  void dropsRecordWithoutIdentifier() throws Exception {
    assertThat(mapper.fromRecord(objectMapper.readTree("{\"aircraft\":\"A320\"}"))).isEmpty();
    assertThat(mapper.fromRecord(objectMapper.readTree("[1,2]"))).isEmpty();
  }

  @Test
  void blankOptionalValuesBecomeAbsent() {
    FlightEvent event = new FlightEvent(" ual456 ", "", " ", null, "KSEA", null, null, "", null, Map.of());

    assertThat(event.callsign()).isEqualTo("ual456");
    assertThat(event.normalizedCallsign()).isEqualTo("UAL456");
    assertThat(event.pilotName()).isNull();
    assertThat(event.aircraftType()).isNull();
    assertThat(event.route()).isNull();
    assertThat(event.arrivalAirport()).isEqualTo("KSEA");
  }

  @Test
  void rejectsBlankCallsign() {
    assertThatThrownBy(() -> FlightEvent.ofCallsign(" ")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void dedupKeyCombinesCallsignPilotAndAirports() {
    FlightEvent event = new FlightEvent("SWA10", "X", "B737", "KLAX", "KSEA", "350", "IFR", null, null, Map.of());

    assertThat(event.dedupKey()).isEqualTo(new DedupKey("SWA10", "X", "KLAX", "KSEA"));
    assertThat(event.dedupKey().toString()).isEqualTo("SWA10_X_KLAX_KSEA");
    assertThat(FlightEvent.ofCallsign("SWA10").dedupKey()).isEqualTo(new DedupKey("SWA10", "", "", ""));
  }
}
