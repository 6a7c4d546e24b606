package com.skytrack.tracker.loop;

import com.skytrack.tracker.model.TelemetrySample;

/** One telemetry sample for one aircraft, as handed to the tick loop. */
public record Observation(String id, TelemetrySample sample) {}
