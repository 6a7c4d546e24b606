package com.skytrack.tracker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Compact row returned by frequency-context queries. */
public record TrafficContextEntry(
  @JsonProperty("id") String id,
  @JsonProperty("state") TrafficState state,
  @JsonProperty("altitude_ft") double altitudeFt,
  @JsonProperty("airspeed_kt") double airspeedKt
) {
  public static TrafficContextEntry from(AircraftSnapshot snapshot) {
    return new TrafficContextEntry(
        snapshot.id(),
        snapshot.state(),
        snapshot.altitudeFt(),
        snapshot.airspeedKt());
  }
}
