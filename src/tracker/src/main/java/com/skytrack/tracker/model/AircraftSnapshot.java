package com.skytrack.tracker.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only copy of a tracked aircraft, used for radar snapshots and context queries.
 *
 * <p>{@code pendingState} is null when no candidate is waiting for confirmation.
 */
public record AircraftSnapshot(
  @JsonProperty("id") String id,
  @JsonProperty("lat") double lat,
  @JsonProperty("lon") double lon,
  @JsonProperty("altitude_ft") double altitudeFt,
  @JsonProperty("heading_deg") double headingDeg,
  @JsonProperty("airspeed_kt") double airspeedKt,
  @JsonProperty("vertical_speed_fpm") double verticalSpeedFpm,
  @JsonProperty("state") TrafficState state,
  @JsonProperty("on_ground") boolean onGround,
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonProperty("pending_state") TrafficState pendingState,
  @JsonProperty("voice") String voice
) {}
