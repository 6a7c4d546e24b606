package com.skytrack.tracker.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.skytrack.tracker.event.StateChangeListener;
import com.skytrack.tracker.model.AircraftSnapshot;
import com.skytrack.tracker.model.StateChangedEvent;
import com.skytrack.tracker.model.TelemetrySample;
import com.skytrack.tracker.model.TrackLostEvent;
import com.skytrack.tracker.model.TrafficContextEntry;
import com.skytrack.tracker.model.TrafficState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TrackingRegistryTest {
  private static final Instant T0 = Instant.parse("2026-01-01T12:00:00Z");

  private SimpleMeterRegistry meterRegistry;
  private TrackingRegistry registry;
  private List<StateChangedEvent> events;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    registry = new TrackingRegistry(
        new StateClassifier(new ReversingDetector(true, 0.0003, 120.0)),
        new TeleportDetector(TeleportDetector.DEFAULT_THRESHOLD_NM),
        new HysteresisGate(HysteresisGate.DEFAULT_WINDOW),
        new VoiceAssigner(VoiceAssigner.DEFAULT_VOICES),
        Duration.ofSeconds(30),
        meterRegistry);
    events = new ArrayList<>();
    registry.addListener(events::add);
  }

  @Test
  void cca101ParksThenFlickersWithoutConfirmingTakeoffRoll() {
    registry.update("CCA101", Samples.ground(0), at(0));
    assertThat(current("CCA101").state()).isEqualTo(TrafficState.UNKNOWN);
    assertThat(current("CCA101").pendingState()).isEqualTo(TrafficState.PARKED);

    for (long ms = 500; ms <= 1500; ms += 500) {
      registry.update("CCA101", Samples.ground(0), at(ms));
      assertThat(current("CCA101").pendingState()).isEqualTo(TrafficState.PARKED);
    }
    assertThat(events).isEmpty();

    registry.update("CCA101", Samples.ground(0), at(2000));
    assertThat(current("CCA101").state()).isEqualTo(TrafficState.PARKED);
    assertThat(events).hasSize(1);
    assertThat(events.get(0).oldState()).isEqualTo(TrafficState.UNKNOWN);
    assertThat(events.get(0).newState()).isEqualTo(TrafficState.PARKED);

    registry.update("CCA101", Samples.ground(45), at(2500));
    assertThat(current("CCA101").pendingState()).isEqualTo(TrafficState.TAKEOFF_ROLL);

    registry.update("CCA101", Samples.ground(2), at(3000));
    assertThat(current("CCA101").pendingState()).isEqualTo(TrafficState.TAXIING);
    assertThat(current("CCA101").state()).isEqualTo(TrafficState.PARKED);
    assertThat(events).extracting(StateChangedEvent::newState).doesNotContain(TrafficState.TAKEOFF_ROLL);
  }

  @Test
  void teleportForcesUnknownImmediately() {
    for (long ms = 0; ms <= 2000; ms += 500) {
      registry.update("JBU55", Samples.groundAt(40.00, -73.00, 0), at(ms));
    }
    registry.update("JBU55", Samples.groundAt(40.00, -73.00, 45), at(2500));
    assertThat(current("JBU55").state()).isEqualTo(TrafficState.PARKED);
    assertThat(current("JBU55").pendingState()).isEqualTo(TrafficState.TAKEOFF_ROLL);

    registry.update("JBU55", Samples.groundAt(41.00, -73.00, 0), at(3000));

    AircraftSnapshot reset = current("JBU55");
    assertThat(reset.state()).isEqualTo(TrafficState.UNKNOWN);
    assertThat(reset.pendingState()).isNull();
    assertThat(reset.lat()).isEqualTo(41.00);
    assertThat(events).hasSize(1);
    assertThat(meterRegistry.get("tracker.teleports").counter().count()).isEqualTo(1.0);
  }

  @Test
  void trackResumesClassificationAfterTeleport() {
    registry.update("JBU55", Samples.groundAt(40.00, -73.00, 0), at(0));
    registry.update("JBU55", Samples.groundAt(41.00, -73.00, 0), at(500));
    registry.update("JBU55", Samples.groundAt(41.00, -73.00, 0), at(1000));

    assertThat(current("JBU55").pendingState()).isEqualTo(TrafficState.PARKED);

    registry.update("JBU55", Samples.groundAt(41.00, -73.00, 0), at(3000));

    assertThat(current("JBU55").state()).isEqualTo(TrafficState.PARKED);
  }

  @Test
  void alternatingCandidatesNeverConfirm() {
    confirmParked("DAL9");
    events.clear();

    for (long ms = 2500; ms <= 12000; ms += 500) {
      double speed = (ms / 500) % 2 == 0 ? 10 : 45;
      registry.update("DAL9", Samples.ground(speed), at(ms));
      assertThat(current("DAL9").state()).isEqualTo(TrafficState.PARKED);
    }
    registry.update("DAL9", Samples.ground(0), at(12500));

    assertThat(events).isEmpty();
    assertThat(current("DAL9").state()).isEqualTo(TrafficState.PARKED);
    assertThat(current("DAL9").pendingState()).isNull();
  }

  @Test
  void steadyCandidateEmitsExactlyOnce() {
    for (long ms = 0; ms <= 10000; ms += 500) {
      registry.update("UAL7", Samples.ground(0), at(ms));
      if (ms < 2000) {
        assertThat(events).isEmpty();
      } else {
        assertThat(events).hasSize(1);
      }
    }
    assertThat(meterRegistry.get("tracker.state.changes").tag("state", "PARKED").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void firstAirborneSampleIsTreatedAsLiftoff() {
    registry.update("BAW1", Samples.airborne(2000, -700), at(0));
    assertThat(current("BAW1").pendingState()).isEqualTo(TrafficState.AIRBORNE);

    registry.update("BAW1", Samples.airborne(1990, -700), at(500));
    assertThat(current("BAW1").pendingState()).isEqualTo(TrafficState.APPROACH);
  }

  @Test
  void staleAircraftAreEvictedAndRecentOnesKept() {
    List<TrackLostEvent> lost = new ArrayList<>();
    registry.addTrackLostListener(lost::add);
    registry.update("OLD1", Samples.ground(0), at(0));
    registry.update("NEW1", Samples.ground(0), at(0));
    registry.update("NEW1", Samples.ground(0), at(20_000));

    assertThat(registry.evict(at(29_999))).isEmpty();
    List<TrackLostEvent> evicted = registry.evict(at(30_000));

    assertThat(evicted).extracting(TrackLostEvent::id).containsExactly("OLD1");
    assertThat(lost).containsExactlyElementsOf(evicted);
    assertThat(registry.find("OLD1")).isEmpty();
    assertThat(registry.find("NEW1")).isPresent();
    assertThat(registry.size()).isEqualTo(1);
    assertThat(meterRegistry.get("tracker.evictions").counter().count()).isEqualTo(1.0);
    assertThat(meterRegistry.get("tracker.aircraft.tracked").gauge().value()).isEqualTo(1.0);
  }

  @Test
  void evictionIsSilentOnStateChangeStream() {
    confirmParked("AFR4");
    events.clear();

    registry.evict(at(60_000));

    assertThat(events).isEmpty();
    assertThat(registry.size()).isZero();
  }

  @Test
  void evictedCallsignStartsOverAsUnknown() {
    confirmParked("DLH3");
    String voice = current("DLH3").voice();
    registry.evict(at(60_000));

    registry.update("DLH3", Samples.ground(0), at(61_000));

    assertThat(current("DLH3").state()).isEqualTo(TrafficState.UNKNOWN);
    assertThat(current("DLH3").voice()).isEqualTo(voice);
  }

  @Test
  void voiceIsAssignedOnCreationAndStable() {
    registry.update("CCA101", Samples.ground(0), at(0));
    registry.update("CCA101", Samples.ground(20), at(500));

    assertThat(current("CCA101").voice())
        .isEqualTo(new VoiceAssigner(VoiceAssigner.DEFAULT_VOICES).assignVoice("CCA101"));
  }

  @Test
  void groundContextReturnsExactlySlowSurfaceTraffic() {
    registry.update("GND1", Samples.ground(0), at(0));
    registry.update("GND2", Samples.ground(39), at(0));
    registry.update("TWR1", Samples.ground(40), at(0));
    registry.update("APP1", Samples.airborne(2500, -600), at(0));

    List<TrafficContextEntry> ground = registry.getInContext("ground");

    assertThat(ground).extracting(TrafficContextEntry::id).containsExactly("GND1", "GND2");
    assertThat(ground.get(1).airspeedKt()).isEqualTo(39.0);
    assertThat(registry.getInContext("tower")).extracting(TrafficContextEntry::id).containsExactly("TWR1", "APP1");
    assertThat(registry.getInContext("anything")).hasSize(4);
  }

  @Test
  void failingListenerDoesNotBreakUpdatesOrOtherListeners() {
    List<StateChangedEvent> second = new ArrayList<>();
    TrackingRegistry isolated = new TrackingRegistry(
        new StateClassifier(ReversingDetector.disabled()),
        new TeleportDetector(5.0),
        new HysteresisGate(Duration.ofSeconds(2)),
        new VoiceAssigner(VoiceAssigner.DEFAULT_VOICES),
        Duration.ofSeconds(30),
        new SimpleMeterRegistry());
    isolated.addListener(event -> {
      throw new IllegalStateException("consumer down");
    });
    isolated.addListener(second::add);

    isolated.update("AAL1", Samples.ground(0), at(0));
    isolated.update("AAL1", Samples.ground(0), at(2000));

    assertThat(second).hasSize(1);
    assertThat(isolated.find("AAL1")).map(AircraftSnapshot::state).contains(TrafficState.PARKED);
  }

  @Test
  void removedListenerReceivesNothing() {
    List<StateChangedEvent> removed = new ArrayList<>();
    StateChangeListener listener = removed::add;
    registry.addListener(listener);
    registry.removeListener(listener);

    confirmParked("SWA1");

    assertThat(removed).isEmpty();
    assertThat(events).hasSize(1);
  }

  @Test
  void snapshotIsADetachedCopy() {
    registry.update("CCA101", Samples.ground(0), at(0));
    List<AircraftSnapshot> snapshot = registry.snapshot();

    registry.update("CCA101", Samples.ground(20), at(500));
    registry.update("DAL2", Samples.ground(0), at(500));

    assertThat(snapshot).hasSize(1);
    assertThat(snapshot.get(0).airspeedKt()).isZero();
  }

  @Test
  void nullIdentifierIsRejected() {
    TelemetrySample sample = Samples.ground(0);

    assertThatThrownBy(() -> registry.update(null, sample, at(0)))
        .isInstanceOf(NullPointerException.class);
  }

  private void confirmParked(String id) {
    registry.update(id, Samples.ground(0), at(0));
    registry.update(id, Samples.ground(0), at(2000));
    assertThat(current(id).state()).isEqualTo(TrafficState.PARKED);
  }

  private AircraftSnapshot current(String id) {
    return registry.find(id).orElseThrow();
  }

  private static Instant at(long millis) {
    return T0.plusMillis(millis);
  }
}
