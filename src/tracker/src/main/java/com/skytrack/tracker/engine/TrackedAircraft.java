package com.skytrack.tracker.engine;

import com.skytrack.tracker.model.AircraftSnapshot;
import com.skytrack.tracker.model.TelemetrySample;
import com.skytrack.tracker.model.TrafficState;
import java.time.Duration;
import java.time.Instant;

/**
 * Mutable per-aircraft tracking record.
 *
 * <p>Owned by {@link TrackingRegistry} and only touched while its lock is held. Callers outside
 * the engine see {@link AircraftSnapshot} copies, never this object.
 */
final class TrackedAircraft {
  private final String id;
  private final String voice;
  private TrafficState confirmedState = TrafficState.UNKNOWN;
  private TrafficState pendingState;
  private Instant pendingSince;
  private TelemetrySample telemetry = TelemetrySample.INITIAL;
  private TelemetrySample prevTelemetry = TelemetrySample.INITIAL;
  private Instant lastSeen;

  TrackedAircraft(String id, String voice, Instant createdAt) {
    this.id = id;
    this.voice = voice;
    this.lastSeen = createdAt;
  }

  /**
   * Stores a new sample and returns the telemetry it replaces.
   */
  TelemetrySample record(TelemetrySample sample, Instant now) {
    prevTelemetry = telemetry;
    telemetry = sample;
    lastSeen = now;
    return prevTelemetry;
  }

  void resetToUnknown() {
    confirmedState = TrafficState.UNKNOWN;
    clearPending();
  }

  void markPending(TrafficState state, Instant since) {
    pendingState = state;
    pendingSince = since;
  }

  void confirm(TrafficState state) {
    confirmedState = state;
    clearPending();
  }

  void clearPending() {
    pendingState = null;
    pendingSince = null;
  }

  boolean isStale(Instant now, Duration timeout) {
    return Duration.between(lastSeen, now).compareTo(timeout) >= 0;
  }

  AircraftSnapshot toSnapshot() {
    return new AircraftSnapshot(
        id,
        telemetry.lat(),
        telemetry.lon(),
        telemetry.altitudeFt(),
        telemetry.headingDeg(),
        telemetry.airspeedKt(),
        telemetry.verticalSpeedFpm(),
        confirmedState,
        telemetry.onGround(),
        pendingState,
        voice);
  }

  String id() {
    return id;
  }

  String voice() {
    return voice;
  }

  TrafficState confirmedState() {
    return confirmedState;
  }

  TrafficState pendingState() {
    return pendingState;
  }

  Instant pendingSince() {
    return pendingSince;
  }

  TelemetrySample telemetry() {
    return telemetry;
  }

  Instant lastSeen() {
    return lastSeen;
  }
}
