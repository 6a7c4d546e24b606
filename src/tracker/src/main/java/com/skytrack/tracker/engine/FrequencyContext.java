package com.skytrack.tracker.engine;

import com.skytrack.tracker.model.AircraftSnapshot;

/** Radio frequency domains used to scope traffic queries. */
public enum FrequencyContext {
  GROUND {
    @Override
    public boolean matches(AircraftSnapshot aircraft) {
      return aircraft.onGround() && aircraft.airspeedKt() < 40;
    }
  },
  TOWER {
    @Override
    public boolean matches(AircraftSnapshot aircraft) {
      return (aircraft.onGround() && aircraft.airspeedKt() >= 40)
          || (!aircraft.onGround() && aircraft.altitudeFt() < 3000);
    }
  },
  APPROACH {
    @Override
    public boolean matches(AircraftSnapshot aircraft) {
      return !aircraft.onGround() && aircraft.altitudeFt() < 10000 && aircraft.verticalSpeedFpm() < 0;
    }
  },
  CENTER {
    @Override
    public boolean matches(AircraftSnapshot aircraft) {
      return !aircraft.onGround() && aircraft.altitudeFt() >= 10000;
    }
  },
  /** Fallback for unrecognized tags: everything matches. */
  ALL {
    @Override
    public boolean matches(AircraftSnapshot aircraft) {
      return true;
    }
  };

  public abstract boolean matches(AircraftSnapshot aircraft);

  /**
   * Resolves a context tag such as {@code "ground"} or {@code "tower"}.
   *
   * <p>Only the exact lowercase tags select a context; anything else, including {@code "GROUND"}
   * or a padded tag, falls back to {@link #ALL}.
   *
   * @param tag context tag, may be null
   * @return matching context, {@link #ALL} for null or unknown tags
   */
  public static FrequencyContext fromTag(String tag) {
    if (tag == null) {
      return ALL;
    }
    return switch (tag) {
      case "ground" -> GROUND;
      case "tower" -> TOWER;
      case "approach" -> APPROACH;
      case "center" -> CENTER;
      default -> ALL;
    };
  }
}
