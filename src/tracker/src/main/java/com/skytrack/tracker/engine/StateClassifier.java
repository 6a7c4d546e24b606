package com.skytrack.tracker.engine;

import com.skytrack.tracker.model.TelemetrySample;
import com.skytrack.tracker.model.TrafficState;
import java.util.function.BooleanSupplier;

/**
 * Maps a single telemetry sample to a candidate flight phase.
 *
 * <p>Rules are evaluated in order and the first match wins:
 * <ol>
 *   <li>on ground, below 1 kt: {@code PARKED}</li>
 *   <li>on ground, below 5 kt: {@code PUSHBACK} when reversing, else {@code TAXIING}</li>
 *   <li>on ground, below 40 kt: {@code TAXIING}</li>
 *   <li>on ground otherwise: {@code TAKEOFF_ROLL}</li>
 *   <li>airborne right after a ground sample: {@code AIRBORNE}</li>
 *   <li>airborne below 3000 ft descending faster than 200 fpm: {@code APPROACH}</li>
 *   <li>otherwise: {@code AIRBORNE}</li>
 * </ol>
 */
public class StateClassifier {
  static final double PARKED_MAX_KT = 1.0;
  static final double PUSHBACK_MAX_KT = 5.0;
  static final double TAXI_MAX_KT = 40.0;
  static final double APPROACH_MAX_ALT_FT = 3000.0;
  static final double APPROACH_MAX_VS_FPM = -200.0;

  private final ReversingDetector reversingDetector;

  public StateClassifier(ReversingDetector reversingDetector) {
    this.reversingDetector = reversingDetector;
  }

  /**
   * Classifies a sample without any ground-track information, so it never yields
   * {@code PUSHBACK}.
   */
  public TrafficState classify(TelemetrySample sample, boolean wasOnGround) {
    return classify(sample, wasOnGround, () -> false);
  }

  /**
   * Classifies a sample using the previous telemetry of the same aircraft for the ground-contact
   * edge and the reversing check.
   */
  public TrafficState classify(TelemetrySample sample, TelemetrySample previous) {
    return classify(
        sample,
        previous.onGround(),
        () -> reversingDetector.isReversing(previous, sample));
  }

  private TrafficState classify(TelemetrySample sample, boolean wasOnGround, BooleanSupplier reversing) {
    double speed = sample.airspeedKt();
    if (sample.onGround()) {
      if (speed < PARKED_MAX_KT) {
        return TrafficState.PARKED;
      }
      if (speed < PUSHBACK_MAX_KT) {
        return reversing.getAsBoolean() ? TrafficState.PUSHBACK : TrafficState.TAXIING;
      }
      if (speed < TAXI_MAX_KT) {
        return TrafficState.TAXIING;
      }
      return TrafficState.TAKEOFF_ROLL;
    }

    if (wasOnGround) {
      return TrafficState.AIRBORNE;
    }
    if (sample.altitudeFt() < APPROACH_MAX_ALT_FT && sample.verticalSpeedFpm() < APPROACH_MAX_VS_FPM) {
      return TrafficState.APPROACH;
    }
    return TrafficState.AIRBORNE;
  }
}
