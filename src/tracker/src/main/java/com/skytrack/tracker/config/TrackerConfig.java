package com.skytrack.tracker.config;

import com.skytrack.tracker.engine.HysteresisGate;
import com.skytrack.tracker.engine.ReversingDetector;
import com.skytrack.tracker.engine.StateClassifier;
import com.skytrack.tracker.engine.TeleportDetector;
import com.skytrack.tracker.engine.TrackingRegistry;
import com.skytrack.tracker.engine.VoiceAssigner;
import com.skytrack.tracker.event.StateChangeListener;
import com.skytrack.tracker.event.TrackLostListener;
import com.skytrack.tracker.simulation.SyntheticTrafficSource;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TrackerConfig {
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public StateClassifier stateClassifier(TrackerProperties properties) {
    TrackerProperties.Pushback pushback = properties.getPushback();
    return new StateClassifier(new ReversingDetector(
        pushback.isEnabled(),
        pushback.getMinTrackNm(),
        pushback.getReverseAngleDeg()));
  }

  @Bean
  public TrackingRegistry trackingRegistry(
      TrackerProperties properties,
      StateClassifier stateClassifier,
      MeterRegistry meterRegistry,
      ObjectProvider<StateChangeListener> stateChangeListeners,
      ObjectProvider<TrackLostListener> trackLostListeners) {
    TrackingRegistry registry = new TrackingRegistry(
        stateClassifier,
        new TeleportDetector(properties.getTeleportThresholdNm()),
        new HysteresisGate(Duration.ofMillis(properties.getHysteresisMs())),
        new VoiceAssigner(properties.getVoices()),
        Duration.ofSeconds(properties.getStaleTimeoutSeconds()),
        meterRegistry);
    stateChangeListeners.orderedStream().forEach(registry::addListener);
    trackLostListeners.orderedStream().forEach(registry::addTrackLostListener);
    return registry;
  }

  @Bean
  @ConditionalOnProperty(prefix = "tracker.simulation", name = "enabled", havingValue = "true")
  public SyntheticTrafficSource syntheticTrafficSource(TrackerProperties properties) {
    return new SyntheticTrafficSource(properties.getSimulation());
  }
}
