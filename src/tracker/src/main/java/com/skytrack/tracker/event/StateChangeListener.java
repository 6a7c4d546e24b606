package com.skytrack.tracker.event;

import com.skytrack.tracker.model.StateChangedEvent;

/** Consumer of confirmed flight-phase transitions. */
@FunctionalInterface
public interface StateChangeListener {
  void onStateChanged(StateChangedEvent event);
}
