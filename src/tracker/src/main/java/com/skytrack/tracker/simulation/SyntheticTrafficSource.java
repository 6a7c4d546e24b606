package com.skytrack.tracker.simulation;

import com.skytrack.tracker.config.TrackerProperties;
import com.skytrack.tracker.loop.Observation;
import com.skytrack.tracker.loop.TelemetrySource;
import com.skytrack.tracker.model.GeoPosition;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic mock traffic around a reference airfield.
 *
 * <p>Each aircraft flies the {@link FlightPhase} cycle from its own seeded offset, so a fleet
 * covers every phase at once. Samples are advanced by the wall time elapsed between polls.
 */
public class SyntheticTrafficSource implements TelemetrySource {
  private static final Logger log = LoggerFactory.getLogger(SyntheticTrafficSource.class);
  private static final String[] AIRLINES = {"AAL", "DAL", "UAL", "JBU", "CCA", "BAW", "AFR", "DLH"};
  private static final int FLIGHT_NUMBERS_PER_AIRLINE = 900;
  static final int MAX_AIRCRAFT = AIRLINES.length * FLIGHT_NUMBERS_PER_AIRLINE;
  private static final double STAND_SPREAD_DEG = 0.02;

  private final List<SimulatedFlight> flights;
  private Instant lastPollAt;

  public SyntheticTrafficSource(TrackerProperties.Simulation properties) {
    int count = properties.getAircraftCount();
    if (count < 0 || count > MAX_AIRCRAFT) {
      throw new IllegalArgumentException(
          "tracker.simulation.aircraft-count must be between 0 and " + MAX_AIRCRAFT + ", got " + count);
    }
    Random random = new Random(properties.getSeed());
    this.flights = new ArrayList<>();
    for (String callsign : callsigns(random, count)) {
      GeoPosition stand = new GeoPosition(
          properties.getOriginLat() + (random.nextDouble() - 0.5) * STAND_SPREAD_DEG,
          properties.getOriginLon() + (random.nextDouble() - 0.5) * STAND_SPREAD_DEG);
      double heading = random.nextDouble() * 360.0;
      double offset = random.nextDouble() * FlightPhase.cycleSeconds();
      flights.add(new SimulatedFlight(callsign, stand, heading, offset));
    }
    log.info(
        "Synthetic traffic enabled: {} aircraft around {},{} (seed={})",
        flights.size(),
        properties.getOriginLat(),
        properties.getOriginLon(),
        properties.getSeed());
  }

  @Override
  public synchronized List<Observation> poll(Instant now) {
    double dtSeconds = lastPollAt == null
        ? 0.0
        : Math.max(0L, Duration.between(lastPollAt, now).toMillis()) / 1000.0;
    lastPollAt = now;

    List<Observation> observations = new ArrayList<>(flights.size());
    for (SimulatedFlight flight : flights) {
      flight.advance(dtSeconds);
      observations.add(new Observation(flight.callsign(), flight.sample()));
    }
    return observations;
  }

  public List<String> callsigns() {
    return flights.stream().map(SimulatedFlight::callsign).toList();
  }

  private static Set<String> callsigns(Random random, int count) {
    Set<String> callsigns = new LinkedHashSet<>();
    while (callsigns.size() < count) {
      String airline = AIRLINES[random.nextInt(AIRLINES.length)];
      callsigns.add(airline + String.format("%03d", 100 + random.nextInt(FLIGHT_NUMBERS_PER_AIRLINE)));
    }
    return callsigns;
  }
}
