package com.skytrack.tracker.model;

import java.time.Instant;
import java.util.List;

/** Bulk picture of every tracked aircraft at one instant, emitted on the snapshot cadence. */
public record RadarSnapshot(Instant capturedAt, List<AircraftSnapshot> aircraft) {
  public RadarSnapshot {
    aircraft = List.copyOf(aircraft);
  }
}
