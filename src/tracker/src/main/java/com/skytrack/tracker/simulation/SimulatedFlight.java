package com.skytrack.tracker.simulation;

import com.skytrack.tracker.engine.GreatCircle;
import com.skytrack.tracker.model.GeoPosition;
import com.skytrack.tracker.model.TelemetrySample;

/** Dead-reckoned state of one synthetic aircraft. */
final class SimulatedFlight {
  private static final double SECONDS_PER_HOUR = 3600.0;

  private final String callsign;
  private GeoPosition position;
  private double headingDeg;
  private FlightPhase phase;
  private double elapsedInPhase;

  SimulatedFlight(String callsign, GeoPosition start, double headingDeg, double cycleOffsetSeconds) {
    this.callsign = callsign;
    this.position = start;
    this.headingDeg = headingDeg;
    this.phase = FlightPhase.PARKED;
    this.elapsedInPhase = 0.0;
    skipTo(cycleOffsetSeconds % FlightPhase.cycleSeconds());
  }

  private void skipTo(double offsetSeconds) {
    double remaining = offsetSeconds;
    while (remaining >= phase.durationSeconds) {
      remaining -= phase.durationSeconds;
      enter(phase.next());
    }
    elapsedInPhase = remaining;
  }

  void advance(double dtSeconds) {
    elapsedInPhase += dtSeconds;
    while (elapsedInPhase >= phase.durationSeconds) {
      elapsedInPhase -= phase.durationSeconds;
      enter(phase.next());
    }

    double distanceNm = phase.speedAt(fraction()) * dtSeconds / SECONDS_PER_HOUR;
    if (distanceNm > 0) {
      double course = phase.movesBackward() ? headingDeg + 180.0 : headingDeg;
      position = GreatCircle.destination(position, course % 360.0, distanceNm);
    }
  }

  private void enter(FlightPhase nextPhase) {
    if (nextPhase == FlightPhase.TAXI_IN) {
      // Head back toward the stand.
      headingDeg = (headingDeg + 180.0) % 360.0;
    }
    phase = nextPhase;
  }

  TelemetrySample sample() {
    double fraction = fraction();
    return new TelemetrySample(
        position.lat(),
        position.lon(),
        phase.altitudeAt(fraction),
        headingDeg,
        phase.speedAt(fraction),
        phase.verticalSpeedFpm(),
        phase.onGround);
  }

  private double fraction() {
    return Math.min(1.0, elapsedInPhase / phase.durationSeconds);
  }

  String callsign() {
    return callsign;
  }

  FlightPhase phase() {
    return phase;
  }
}
