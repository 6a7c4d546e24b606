package com.skytrack.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Spring Boot entrypoint for the tracker service.
 *
 * <p>The tracker consumes per-aircraft telemetry, classifies each aircraft's flight phase with
 * debouncing, and publishes confirmed transitions and periodic radar snapshots to in-process
 * listeners.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TrackerApplication {
  /**
   * Starts the tracker application.
   *
   * @param args CLI arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(TrackerApplication.class, args);
  }
}
