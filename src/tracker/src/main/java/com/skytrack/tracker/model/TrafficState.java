package com.skytrack.tracker.model;

/**
 * Flight-phase classification exposed for each tracked aircraft.
 *
 * <p>{@link #LANDING} and {@link #VACATING} are reserved: the classifier never produces them today.
 */
public enum TrafficState {
  UNKNOWN,
  PARKED,
  PUSHBACK,
  TAXIING,
  TAKEOFF_ROLL,
  AIRBORNE,
  APPROACH,
  LANDING,
  VACATING
}
