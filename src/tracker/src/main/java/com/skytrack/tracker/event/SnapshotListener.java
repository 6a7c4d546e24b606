package com.skytrack.tracker.event;

import com.skytrack.tracker.model.RadarSnapshot;

/** Consumer of the periodic bulk radar snapshot. */
@FunctionalInterface
public interface SnapshotListener {
  void onSnapshot(RadarSnapshot snapshot);
}
