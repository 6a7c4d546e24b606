package com.skytrack.tracker.loop;

import com.skytrack.tracker.config.TrackerProperties;
import com.skytrack.tracker.engine.TrackingRegistry;
import com.skytrack.tracker.event.SnapshotListener;
import com.skytrack.tracker.model.RadarSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Fixed-cadence driver and sole writer of the {@link TrackingRegistry}.
 *
 * <p>Each tick:
 * <ul>
 *   <li>polls every {@link TelemetrySource} and applies its observations one by one</li>
 *   <li>emits a {@link RadarSnapshot} when the snapshot interval has elapsed</li>
 *   <li>runs the eviction sweep when the eviction interval has elapsed</li>
 * </ul>
 *
 * <p>A failing observation is logged and counted; the rest of the tick still runs.
 */
@Component
@ConditionalOnProperty(prefix = "tracker.loop", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TrafficTickLoop {
  private static final Logger LOGGER = LoggerFactory.getLogger(TrafficTickLoop.class);

  private final TrackingRegistry registry;
  private final List<TelemetrySource> sources;
  private final List<SnapshotListener> snapshotListeners;
  private final TrackerProperties.Loop properties;
  private final Clock clock;
  private final ScheduledExecutorService scheduler;
  private final Counter errorCounter;
  private final AtomicLong lastTickEpoch;

  private volatile boolean running = false;
  private Instant lastSnapshotAt;
  private Instant lastEvictionAt;

  public TrafficTickLoop(
      TrackingRegistry registry,
      List<TelemetrySource> sources,
      List<SnapshotListener> snapshotListeners,
      TrackerProperties properties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.registry = registry;
    this.sources = List.copyOf(sources);
    this.snapshotListeners = new CopyOnWriteArrayList<>(snapshotListeners);
    this.properties = properties.getLoop();
    this.clock = clock;
    // Non-daemon: this thread is what keeps the service alive.
    this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> new Thread(runnable, "tracker-tick"));
    this.errorCounter = meterRegistry.counter("tracker.updates.errors");
    this.lastTickEpoch = meterRegistry.gauge("tracker.last_tick_epoch", new AtomicLong(0));
  }

  /** Starts ticking after Spring context initialization. */
  @jakarta.annotation.PostConstruct
  public synchronized void start() {
    if (running) {
      return;
    }
    running = true;
    scheduler.scheduleAtFixedRate(this::runTick, 0L, properties.getTickMs(), TimeUnit.MILLISECONDS);
    LOGGER.info(
        "Tick loop started: tick={}ms, snapshot={}ms, eviction={}ms, sources={}",
        properties.getTickMs(),
        properties.getSnapshotIntervalMs(),
        properties.getEvictionIntervalMs(),
        sources.size());
  }

  /** Stops ticking; an in-flight tick runs to completion. */
  @jakarta.annotation.PreDestroy
  public synchronized void stop() {
    running = false;
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
        scheduler.shutdownNow();
      }
    } catch (InterruptedException ex) {
      scheduler.shutdownNow();
      Thread.currentThread().interrupt();
    }
    LOGGER.info("Tick loop stopped");
  }

  public void addSnapshotListener(SnapshotListener listener) {
    snapshotListeners.add(listener);
  }

  /** Scheduled entry point; an escaping exception would cancel the fixed-rate schedule. */
  void runTick() {
    if (!running) {
      return;
    }
    try {
      tick(clock.instant());
    } catch (Exception ex) {
      LOGGER.warn("Tick failed", ex);
    }
  }

  /**
   * Runs one tick at {@code now}.
   *
   * @return number of observations applied successfully
   */
  int tick(Instant now) {
    int applied = 0;
    int received = 0;
    for (TelemetrySource source : sources) {
      List<Observation> observations;
      try {
        observations = source.poll(now);
      } catch (Exception ex) {
        LOGGER.warn("Telemetry source {} failed", source.getClass().getSimpleName(), ex);
        continue;
      }
      received += observations.size();
      for (Observation observation : observations) {
        try {
          registry.update(observation.id(), observation.sample(), now);
          applied++;
        } catch (Exception ex) {
          errorCounter.increment();
          LOGGER.warn("Update failed for {}", observation.id(), ex);
        }
      }
    }

    if (isDue(lastSnapshotAt, now, properties.getSnapshotIntervalMs())) {
      lastSnapshotAt = now;
      emitSnapshot(new RadarSnapshot(now, registry.snapshot()));
    }
    if (isDue(lastEvictionAt, now, properties.getEvictionIntervalMs())) {
      lastEvictionAt = now;
      registry.evict(now);
    }

    lastTickEpoch.set(now.getEpochSecond());
    LOGGER.debug("Tick at {}: {}/{} observations applied, {} tracked", now, applied, received, registry.size());
    return applied;
  }

  private void emitSnapshot(RadarSnapshot snapshot) {
    for (SnapshotListener listener : snapshotListeners) {
      try {
        listener.onSnapshot(snapshot);
      } catch (Exception ex) {
        LOGGER.warn("Snapshot listener failed", ex);
      }
    }
  }

  private static boolean isDue(Instant last, Instant now, long intervalMs) {
    return last == null || Duration.between(last, now).toMillis() >= intervalMs;
  }
}
