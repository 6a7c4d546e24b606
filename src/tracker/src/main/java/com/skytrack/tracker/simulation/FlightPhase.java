package com.skytrack.tracker.simulation;

/**
 * Scripted legs of a synthetic flight, flown in declaration order and then repeated.
 *
 * <p>Speeds are in knots and altitudes in feet; both interpolate linearly across the leg.
 */
enum FlightPhase {
  PARKED(60, true, 0, 0, 0, 0),
  PUSHBACK(30, true, 3, 3, 0, 0),
  TAXI_OUT(90, true, 15, 15, 0, 0),
  TAKEOFF_ROLL(30, true, 45, 150, 0, 0),
  CLIMB(240, false, 220, 280, 0, 8000),
  CRUISE(300, false, 450, 450, 8000, 8000),
  DESCENT(240, false, 300, 220, 8000, 2500),
  APPROACH(180, false, 180, 140, 2500, 0),
  ROLLOUT(25, true, 130, 20, 0, 0),
  TAXI_IN(90, true, 15, 15, 0, 0);

  final double durationSeconds;
  final boolean onGround;
  private final double startSpeedKt;
  private final double endSpeedKt;
  private final double startAltitudeFt;
  private final double endAltitudeFt;

  FlightPhase(
      double durationSeconds,
      boolean onGround,
      double startSpeedKt,
      double endSpeedKt,
      double startAltitudeFt,
      double endAltitudeFt) {
    this.durationSeconds = durationSeconds;
    this.onGround = onGround;
    this.startSpeedKt = startSpeedKt;
    this.endSpeedKt = endSpeedKt;
    this.startAltitudeFt = startAltitudeFt;
    this.endAltitudeFt = endAltitudeFt;
  }

  double speedAt(double fraction) {
    return startSpeedKt + (endSpeedKt - startSpeedKt) * fraction;
  }

  double altitudeAt(double fraction) {
    return startAltitudeFt + (endAltitudeFt - startAltitudeFt) * fraction;
  }

  double verticalSpeedFpm() {
    return (endAltitudeFt - startAltitudeFt) / (durationSeconds / 60.0);
  }

  /** Pushback moves tail-first. */
  boolean movesBackward() {
    return this == PUSHBACK;
  }

  FlightPhase next() {
    FlightPhase[] phases = values();
    return phases[(ordinal() + 1) % phases.length];
  }

  static double cycleSeconds() {
    double total = 0;
    for (FlightPhase phase : values()) {
      total += phase.durationSeconds;
    }
    return total;
  }
}
