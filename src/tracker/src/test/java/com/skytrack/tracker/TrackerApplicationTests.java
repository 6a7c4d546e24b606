package com.skytrack.tracker;

import static org.assertj.core.api.Assertions.assertThat;

import com.skytrack.tracker.engine.TrackingRegistry;
import com.skytrack.tracker.loop.ObservationQueue;
import com.skytrack.tracker.loop.TrafficTickLoop;
import com.skytrack.tracker.model.TelemetrySample;
import com.skytrack.tracker.simulation.SyntheticTrafficSource;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest(properties = {"tracker.loop.enabled=false"})
class TrackerApplicationTests {
  @Autowired
  private ApplicationContext applicationContext;

  @Autowired
  private TrackingRegistry trackingRegistry;

  @Autowired
  private ObservationQueue observationQueue;

  @Test
  void contextLoadsWithoutTickLoopOrSimulation() {
    assertThat(applicationContext.getBeansOfType(TrafficTickLoop.class)).isEmpty();
    assertThat(applicationContext.getBeansOfType(SyntheticTrafficSource.class)).isEmpty();
    assertThat(observationQueue.size()).isZero();
  }

  @Test
  void registryIsWiredFromConfiguration() {
    Instant now = Instant.parse("2026-01-01T00:00:00Z");
    trackingRegistry.update("CTX1", new TelemetrySample(40.0, -73.0, 0, 0, 0, 0, true), now);

    assertThat(trackingRegistry.getInContext("ground")).extracting("id").contains("CTX1");
  }
}
