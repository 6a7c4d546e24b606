package com.skytrack.tracker.engine;

import com.skytrack.tracker.model.AircraftSnapshot;
import java.util.List;

/** Read-only frequency-context predicates over aircraft snapshots. */
public final class ContextFilter {
  private ContextFilter() {}

  public static boolean matches(AircraftSnapshot aircraft, String contextTag) {
    return FrequencyContext.fromTag(contextTag).matches(aircraft);
  }

  public static List<AircraftSnapshot> filter(List<AircraftSnapshot> aircraft, String contextTag) {
    FrequencyContext context = FrequencyContext.fromTag(contextTag);
    return aircraft.stream()
        .filter(context::matches)
        .toList();
  }
}
