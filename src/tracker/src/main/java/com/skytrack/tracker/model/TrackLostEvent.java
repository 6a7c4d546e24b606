package com.skytrack.tracker.model;

import java.time.Instant;

/** Notification that an aircraft was evicted after going unobserved for the stale timeout. */
public record TrackLostEvent(String id, TrafficState lastState, Instant lastSeen) {}
