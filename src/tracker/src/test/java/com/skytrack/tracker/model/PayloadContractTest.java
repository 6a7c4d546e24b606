package com.skytrack.tracker.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class PayloadContractTest {
  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void parsesSnakeCaseTelemetryAndIgnoresUnknownFields() throws Exception {
    String payload = """
        {
          "lat": 40.6413,
          "lon": -73.7781,
          "altitude_ft": 2400.0,
          "heading_deg": 310.0,
          "airspeed_kt": 145.0,
          "vertical_speed_fpm": -750.0,
          "on_ground": false,
          "squawk": "1200"
        }
        """;

    TelemetrySample sample = objectMapper.readValue(payload, TelemetrySample.class);

    assertThat(sample.lat()).isEqualTo(40.6413);
    assertThat(sample.lon()).isEqualTo(-73.7781);
    assertThat(sample.altitudeFt()).isEqualTo(2400.0);
    assertThat(sample.headingDeg()).isEqualTo(310.0);
    assertThat(sample.airspeedKt()).isEqualTo(145.0);
    assertThat(sample.verticalSpeedFpm()).isEqualTo(-750.0);
    assertThat(sample.onGround()).isFalse();
  }

  @Test
  void snapshotUsesContractFieldNamesAndOmitsMissingPendingState() throws Exception {
    AircraftSnapshot snapshot = new AircraftSnapshot(
        "CCA101", 40.0, -73.0, 0.0, 90.0, 0.0, 0.0, TrafficState.PARKED, true, null, "en-GB-RyanNeural");

    JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(snapshot));

    assertThat(json.get("state").asText()).isEqualTo("PARKED");
    assertThat(json.has("altitude_ft")).isTrue();
    assertThat(json.has("vertical_speed_fpm")).isTrue();
    assertThat(json.has("on_ground")).isTrue();
    assertThat(json.has("pending_state")).isFalse();
    assertThat(json.has("altitudeFt")).isFalse();
  }

  @Test
  void stateChangeCarriesTelemetrySnapshotAndVoice() throws Exception {
    StateChangedEvent event = new StateChangedEvent(
        "CCA101",
        TrafficState.UNKNOWN,
        TrafficState.PARKED,
        new TelemetrySample(40.0, -73.0, 0.0, 90.0, 0.0, 0.0, true),
        "en-US-GuyNeural");

    JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(event));

    assertThat(json.get("old_state").asText()).isEqualTo("UNKNOWN");
    assertThat(json.get("new_state").asText()).isEqualTo("PARKED");
    assertThat(json.get("telemetry").get("lat").asDouble()).isEqualTo(40.0);
    assertThat(json.get("telemetry").has("position")).isFalse();
    assertThat(json.get("voice").asText()).isEqualTo("en-US-GuyNeural");
  }
}
