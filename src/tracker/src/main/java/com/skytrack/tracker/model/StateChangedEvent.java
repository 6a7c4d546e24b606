package com.skytrack.tracker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Confirmed flight-phase transition of one aircraft.
 *
 * <p>Emitted exactly once per transition, when the pending state has held for the full
 * hysteresis window.
 */
public record StateChangedEvent(
  @JsonProperty("id") String id,
  @JsonProperty("old_state") TrafficState oldState,
  @JsonProperty("new_state") TrafficState newState,
  @JsonProperty("telemetry") TelemetrySample telemetry,
  @JsonProperty("voice") String voice
) {}
