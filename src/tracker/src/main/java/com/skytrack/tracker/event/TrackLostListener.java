package com.skytrack.tracker.event;

import com.skytrack.tracker.model.TrackLostEvent;

/** Consumer of stale-track evictions, e.g. to drop radar blips. */
@FunctionalInterface
public interface TrackLostListener {
  void onTrackLost(TrackLostEvent event);
}
