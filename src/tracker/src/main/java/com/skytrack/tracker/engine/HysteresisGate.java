package com.skytrack.tracker.engine;

import com.skytrack.tracker.model.StateChangedEvent;
import com.skytrack.tracker.model.TrafficState;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Debounces candidate states before they become the confirmed state of an aircraft.
 *
 * <p>A candidate must be observed continuously for the whole window. Any different candidate
 * restarts the timer, and a candidate equal to the confirmed state drops whatever was pending.
 */
public class HysteresisGate {
  public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(2);

  private final Duration window;

  public HysteresisGate(Duration window) {
    this.window = window;
  }

  Optional<StateChangedEvent> apply(TrackedAircraft aircraft, TrafficState candidate, Instant now) {
    if (candidate == aircraft.confirmedState()) {
      aircraft.clearPending();
      return Optional.empty();
    }

    if (candidate != aircraft.pendingState()) {
      aircraft.markPending(candidate, now);
      return Optional.empty();
    }

    if (Duration.between(aircraft.pendingSince(), now).compareTo(window) < 0) {
      return Optional.empty();
    }

    TrafficState oldState = aircraft.confirmedState();
    aircraft.confirm(candidate);
    return Optional.of(new StateChangedEvent(
        aircraft.id(),
        oldState,
        candidate,
        aircraft.telemetry(),
        aircraft.voice()));
  }
}
