package com.skytrack.tracker.event;

import com.skytrack.tracker.model.RadarSnapshot;
import com.skytrack.tracker.model.StateChangedEvent;
import com.skytrack.tracker.model.TrackLostEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Built-in consumer that writes traffic events to the application log.
 */
@Component
public class LoggingTrafficListener implements StateChangeListener, SnapshotListener, TrackLostListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingTrafficListener.class);

  @Override
  public void onStateChanged(StateChangedEvent event) {
    log.info(
        "{} state: {} -> {} (alt={}ft, spd={}kt, voice={})",
        event.id(),
        event.oldState(),
        event.newState(),
        Math.round(event.telemetry().altitudeFt()),
        Math.round(event.telemetry().airspeedKt()),
        event.voice());
  }

  @Override
  public void onSnapshot(RadarSnapshot snapshot) {
    log.debug("Radar snapshot at {}: {} aircraft", snapshot.capturedAt(), snapshot.aircraft().size());
  }

  @Override
  public void onTrackLost(TrackLostEvent event) {
    log.info("{} track lost (last state {}, last seen {})", event.id(), event.lastState(), event.lastSeen());
  }
}
