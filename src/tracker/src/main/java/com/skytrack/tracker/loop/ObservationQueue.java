package com.skytrack.tracker.loop;

import com.skytrack.tracker.config.TrackerProperties;
import com.skytrack.tracker.model.TelemetrySample;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Bounded inbound buffer for external telemetry producers (simulator bridges, replay tools).
 *
 * <p>Producers may submit from any thread; the tick loop drains the queue so it stays the only
 * writer of the tracking registry. When the queue is full, new observations are dropped and
 * counted.
 */
@Component
public class ObservationQueue implements TelemetrySource {
  private static final Logger LOGGER = LoggerFactory.getLogger(ObservationQueue.class);

  private final LinkedBlockingQueue<Observation> pending;
  private final AtomicLong dropped = new AtomicLong();
  private final AtomicBoolean overflowing = new AtomicBoolean(false);

  @Autowired
  public ObservationQueue(TrackerProperties properties) {
    this(properties.getLoop().getQueueCapacity());
  }

  public ObservationQueue(int capacity) {
    this.pending = new LinkedBlockingQueue<>(capacity);
  }

  /**
   * Enqueues an observation for the next tick.
   *
   * @return false when the queue is full and the observation was dropped
   */
  public boolean submit(String id, TelemetrySample sample) {
    Observation observation = new Observation(Objects.requireNonNull(id, "id"), Objects.requireNonNull(sample, "sample"));
    if (pending.offer(observation)) {
      overflowing.set(false);
      return true;
    }
    dropped.incrementAndGet();
    if (overflowing.compareAndSet(false, true)) {
      LOGGER.warn("Observation queue full ({} pending), dropping new observations", pending.size());
    }
    return false;
  }

  @Override
  public List<Observation> poll(Instant now) {
    List<Observation> drained = new ArrayList<>();
    pending.drainTo(drained);
    return drained;
  }

  public int size() {
    return pending.size();
  }

  public long dropped() {
    return dropped.get();
  }
}
