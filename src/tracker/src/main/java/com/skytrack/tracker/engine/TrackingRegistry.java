package com.skytrack.tracker.engine;

import com.skytrack.tracker.event.StateChangeListener;
import com.skytrack.tracker.event.TrackLostListener;
import com.skytrack.tracker.model.AircraftSnapshot;
import com.skytrack.tracker.model.StateChangedEvent;
import com.skytrack.tracker.model.TelemetrySample;
import com.skytrack.tracker.model.TrackLostEvent;
import com.skytrack.tracker.model.TrafficContextEntry;
import com.skytrack.tracker.model.TrafficState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns every tracked aircraft and runs the per-observation pipeline.
 *
 * <p>For each {@link #update} call:
 * <ul>
 *   <li>the aircraft is looked up or created ({@code UNKNOWN}, voice assigned once)</li>
 *   <li>the new sample replaces the current telemetry, which becomes the previous one</li>
 *   <li>a teleport forces the aircraft back to {@code UNKNOWN} and ends the update</li>
 *   <li>otherwise the sample is classified and pushed through the {@link HysteresisGate}</li>
 * </ul>
 *
 * <p>A single lock guards the map. It is held for one aircraft update, one eviction sweep or one
 * snapshot copy, and released before any listener is called.
 */
public class TrackingRegistry {
  private static final Logger LOGGER = LoggerFactory.getLogger(TrackingRegistry.class);

  private final StateClassifier classifier;
  private final TeleportDetector teleportDetector;
  private final HysteresisGate hysteresisGate;
  private final VoiceAssigner voiceAssigner;
  private final Duration staleTimeout;
  private final MeterRegistry meterRegistry;

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, TrackedAircraft> aircraft = new LinkedHashMap<>();
  private final List<StateChangeListener> stateChangeListeners = new CopyOnWriteArrayList<>();
  private final List<TrackLostListener> trackLostListeners = new CopyOnWriteArrayList<>();

  private final Counter processedCounter;
  private final Counter teleportCounter;
  private final Counter evictionCounter;
  private final ConcurrentHashMap<TrafficState, Counter> stateChangeCounters = new ConcurrentHashMap<>();
  private final AtomicInteger trackedCount;

  public TrackingRegistry(
      StateClassifier classifier,
      TeleportDetector teleportDetector,
      HysteresisGate hysteresisGate,
      VoiceAssigner voiceAssigner,
      Duration staleTimeout,
      MeterRegistry meterRegistry) {
    this.classifier = classifier;
    this.teleportDetector = teleportDetector;
    this.hysteresisGate = hysteresisGate;
    this.voiceAssigner = voiceAssigner;
    this.staleTimeout = staleTimeout;
    this.meterRegistry = meterRegistry;
    this.processedCounter = meterRegistry.counter("tracker.updates.processed");
    this.teleportCounter = meterRegistry.counter("tracker.teleports");
    this.evictionCounter = meterRegistry.counter("tracker.evictions");
    this.trackedCount = meterRegistry.gauge("tracker.aircraft.tracked", new AtomicInteger(0));
  }

  public void addListener(StateChangeListener listener) {
    stateChangeListeners.add(listener);
  }

  public void removeListener(StateChangeListener listener) {
    stateChangeListeners.remove(listener);
  }

  public void addTrackLostListener(TrackLostListener listener) {
    trackLostListeners.add(listener);
  }

  public void removeTrackLostListener(TrackLostListener listener) {
    trackLostListeners.remove(listener);
  }

  /**
   * Applies one observation to the aircraft identified by {@code id}.
   *
   * <p>A confirmed transition is delivered to the state-change listeners before this method
   * returns.
   *
   * @param id aircraft identifier (callsign)
   * @param sample latest telemetry
   * @param now observation time
   */
  public void update(String id, TelemetrySample sample, Instant now) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(sample, "sample");
    Objects.requireNonNull(now, "now");

    Optional<StateChangedEvent> event;
    lock.lock();
    try {
      event = applyLocked(id, sample, now);
    } finally {
      lock.unlock();
    }
    processedCounter.increment();
    event.ifPresent(this::publish);
  }

  private Optional<StateChangedEvent> applyLocked(String id, TelemetrySample sample, Instant now) {
    TrackedAircraft tracked = aircraft.get(id);
    if (tracked == null) {
      tracked = new TrackedAircraft(id, voiceAssigner.assignVoice(id), now);
      aircraft.put(id, tracked);
      trackedCount.set(aircraft.size());
      LOGGER.info("New aircraft detected: {} (voice {})", id, tracked.voice());
    }

    TelemetrySample previous = tracked.record(sample, now);
    if (teleportDetector.isTeleport(previous.position(), sample.position())) {
      tracked.resetToUnknown();
      teleportCounter.increment();
      LOGGER.info("{} teleported - resetting state", id);
      return Optional.empty();
    }

    TrafficState candidate = classifier.classify(sample, previous);
    return hysteresisGate.apply(tracked, candidate, now);
  }

  /**
   * Removes every aircraft whose last observation is at least the stale timeout old.
   *
   * @param now sweep time
   * @return one event per removed aircraft, in tracking order
   */
  public List<TrackLostEvent> evict(Instant now) {
    List<TrackLostEvent> evicted = new ArrayList<>();
    lock.lock();
    try {
      Iterator<TrackedAircraft> iterator = aircraft.values().iterator();
      while (iterator.hasNext()) {
        TrackedAircraft tracked = iterator.next();
        if (tracked.isStale(now, staleTimeout)) {
          evicted.add(new TrackLostEvent(tracked.id(), tracked.confirmedState(), tracked.lastSeen()));
          iterator.remove();
        }
      }
      trackedCount.set(aircraft.size());
    } finally {
      lock.unlock();
    }

    for (TrackLostEvent lost : evicted) {
      evictionCounter.increment();
      LOGGER.info("Removed stale aircraft: {}", lost.id());
      for (TrackLostListener listener : trackLostListeners) {
        try {
          listener.onTrackLost(lost);
        } catch (Exception ex) {
          LOGGER.warn("Track-lost listener failed for {}", lost.id(), ex);
        }
      }
    }
    return evicted;
  }

  /** Copies the public view of every tracked aircraft, in first-seen order. */
  public List<AircraftSnapshot> snapshot() {
    lock.lock();
    try {
      List<AircraftSnapshot> copy = new ArrayList<>(aircraft.size());
      for (TrackedAircraft tracked : aircraft.values()) {
        copy.add(tracked.toSnapshot());
      }
      return copy;
    } finally {
      lock.unlock();
    }
  }

  public Optional<AircraftSnapshot> find(String id) {
    lock.lock();
    try {
      return Optional.ofNullable(aircraft.get(id)).map(TrackedAircraft::toSnapshot);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Lists aircraft relevant to a frequency context.
   *
   * @param contextTag {@code ground}, {@code tower}, {@code approach}, {@code center}; any other
   *     value returns every aircraft
   * @return matching aircraft, in first-seen order
   */
  public List<TrafficContextEntry> getInContext(String contextTag) {
    return ContextFilter.filter(snapshot(), contextTag).stream()
        .map(TrafficContextEntry::from)
        .toList();
  }

  public int size() {
    lock.lock();
    try {
      return aircraft.size();
    } finally {
      lock.unlock();
    }
  }

  private void publish(StateChangedEvent event) {
    stateChangeCounters.computeIfAbsent(
        event.newState(),
        state -> meterRegistry.counter("tracker.state.changes", "state", state.name()))
        .increment();
    for (StateChangeListener listener : stateChangeListeners) {
      try {
        listener.onStateChanged(event);
      } catch (Exception ex) {
        LOGGER.warn("State-change listener failed for {}", event.id(), ex);
      }
    }
  }
}
