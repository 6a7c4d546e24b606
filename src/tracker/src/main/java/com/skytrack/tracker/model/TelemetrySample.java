package com.skytrack.tracker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One kinematic observation of an aircraft, as supplied by a telemetry producer.
 *
 * <p>Numeric fields are taken as-is; out-of-range values flow into classification unchecked.
 * Unknown JSON attributes are ignored so producers can send extra fields.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TelemetrySample(
  @JsonProperty("lat") double lat,
  @JsonProperty("lon") double lon,
  @JsonProperty("altitude_ft") double altitudeFt,
  @JsonProperty("heading_deg") double headingDeg,
  @JsonProperty("airspeed_kt") double airspeedKt,
  @JsonProperty("vertical_speed_fpm") double verticalSpeedFpm,
  @JsonProperty("on_ground") boolean onGround
) {
  /** Telemetry of a track that has not been observed yet. */
  public static final TelemetrySample INITIAL = new TelemetrySample(0.0, 0.0, 0.0, 0.0, 0.0, 0.0, true);

  @JsonIgnore
  public GeoPosition position() {
    return new GeoPosition(lat, lon);
  }
}
