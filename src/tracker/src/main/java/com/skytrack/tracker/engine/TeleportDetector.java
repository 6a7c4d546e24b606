package com.skytrack.tracker.engine;

import com.skytrack.tracker.model.GeoPosition;

/**
 * Flags position jumps no real aircraft can make between two consecutive observations.
 *
 * <p>Simulators relocate AI traffic (slew, warp, re-spawn) without any intermediate samples;
 * such a track must restart from {@code UNKNOWN} instead of debouncing into a bogus phase.
 */
public class TeleportDetector {
  public static final double DEFAULT_THRESHOLD_NM = 5.0;

  private final double thresholdNm;

  public TeleportDetector(double thresholdNm) {
    this.thresholdNm = thresholdNm;
  }

  /**
   * Returns whether the move from {@code previous} to {@code current} is a teleport.
   *
   * @param previous last known position, {@link GeoPosition#UNSET} before the first fix
   * @param current newly observed position
   * @return true iff a prior fix exists and the great-circle distance exceeds the threshold
   */
  public boolean isTeleport(GeoPosition previous, GeoPosition current) {
    if (previous.isUnset()) {
      return false;
    }
    return GreatCircle.distanceNm(previous, current) > thresholdNm;
  }

  public double getThresholdNm() {
    return thresholdNm;
  }
}
