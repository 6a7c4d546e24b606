package com.skytrack.tracker.loop;

import java.time.Instant;
import java.util.List;

/**
 * Producer of observations, polled once per tick by {@link TrafficTickLoop}.
 *
 * <p>Observations for the same aircraft are applied in list order.
 */
public interface TelemetrySource {
  List<Observation> poll(Instant now);
}
