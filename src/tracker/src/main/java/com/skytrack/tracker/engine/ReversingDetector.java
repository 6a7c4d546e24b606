package com.skytrack.tracker.engine;

import com.skytrack.tracker.model.TelemetrySample;

/**
 * Detects backward ground movement by comparing the ground track between two fixes with the
 * reported heading.
 *
 * <p>Movements shorter than {@code minTrackNm} are treated as position jitter and never count
 * as reversing.
 */
public class ReversingDetector {
  private final boolean enabled;
  private final double minTrackNm;
  private final double reverseAngleDeg;

  public ReversingDetector(boolean enabled, double minTrackNm, double reverseAngleDeg) {
    this.enabled = enabled;
    this.minTrackNm = minTrackNm;
    this.reverseAngleDeg = reverseAngleDeg;
  }

  /** Detector that never reports reversing. */
  public static ReversingDetector disabled() {
    return new ReversingDetector(false, 0.0, 180.0);
  }

  public boolean isReversing(TelemetrySample previous, TelemetrySample current) {
    if (!enabled || previous.position().isUnset()) {
      return false;
    }
    if (GreatCircle.distanceNm(previous.position(), current.position()) < minTrackNm) {
      return false;
    }
    double groundTrack = GreatCircle.initialBearingDeg(previous.position(), current.position());
    return GreatCircle.angleBetweenDeg(groundTrack, current.headingDeg()) >= reverseAngleDeg;
  }
}
