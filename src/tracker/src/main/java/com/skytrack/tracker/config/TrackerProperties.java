package com.skytrack.tracker.config;

import com.skytrack.tracker.engine.VoiceAssigner;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the tracker service.
 *
 * <p>Values are bound from {@code application.yml} and environment variables under the
 * {@code tracker.*} prefix.
 */
@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {
  private final Pushback pushback = new Pushback();
  private final Loop loop = new Loop();
  private final Simulation simulation = new Simulation();
  private long hysteresisMs = 2000;
  private double teleportThresholdNm = 5.0;
  private long staleTimeoutSeconds = 30;
  private List<String> voices = new ArrayList<>(VoiceAssigner.DEFAULT_VOICES);

  public Pushback getPushback() {
    return pushback;
  }

  public Loop getLoop() {
    return loop;
  }

  public Simulation getSimulation() {
    return simulation;
  }

  public long getHysteresisMs() {
    return hysteresisMs;
  }

  public void setHysteresisMs(long hysteresisMs) {
    this.hysteresisMs = hysteresisMs;
  }

  public double getTeleportThresholdNm() {
    return teleportThresholdNm;
  }

  public void setTeleportThresholdNm(double teleportThresholdNm) {
    this.teleportThresholdNm = teleportThresholdNm;
  }

  public long getStaleTimeoutSeconds() {
    return staleTimeoutSeconds;
  }

  public void setStaleTimeoutSeconds(long staleTimeoutSeconds) {
    this.staleTimeoutSeconds = staleTimeoutSeconds;
  }

  public List<String> getVoices() {
    return voices;
  }

  public void setVoices(List<String> voices) {
    this.voices = voices;
  }

  /** Ground-track heuristic that separates pushback from slow taxi. */
  public static class Pushback {
    private boolean enabled = true;
    private double minTrackNm = 0.0003;
    private double reverseAngleDeg = 120.0;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public double getMinTrackNm() {
      return minTrackNm;
    }

    public void setMinTrackNm(double minTrackNm) {
      this.minTrackNm = minTrackNm;
    }

    public double getReverseAngleDeg() {
      return reverseAngleDeg;
    }

    public void setReverseAngleDeg(double reverseAngleDeg) {
      this.reverseAngleDeg = reverseAngleDeg;
    }
  }

  /** Cadences of the tick loop. */
  public static class Loop {
    private boolean enabled = true;
    private long tickMs = 500;
    private long snapshotIntervalMs = 1000;
    private long evictionIntervalMs = 5000;
    private int queueCapacity = 10_000;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public long getTickMs() {
      return tickMs;
    }

    public void setTickMs(long tickMs) {
      this.tickMs = tickMs;
    }

    public long getSnapshotIntervalMs() {
      return snapshotIntervalMs;
    }

    public void setSnapshotIntervalMs(long snapshotIntervalMs) {
      this.snapshotIntervalMs = snapshotIntervalMs;
    }

    public long getEvictionIntervalMs() {
      return evictionIntervalMs;
    }

    public void setEvictionIntervalMs(long evictionIntervalMs) {
      this.evictionIntervalMs = evictionIntervalMs;
    }

    public int getQueueCapacity() {
      return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
    }
  }

  /** Synthetic traffic used when no live telemetry producer is attached. */
  public static class Simulation {
    private boolean enabled = false;
    private int aircraftCount = 6;
    private long seed = 42;
    private double originLat = 40.6413;
    private double originLon = -73.7781;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getAircraftCount() {
      return aircraftCount;
    }

    public void setAircraftCount(int aircraftCount) {
      this.aircraftCount = aircraftCount;
    }

    public long getSeed() {
      return seed;
    }

    public void setSeed(long seed) {
      this.seed = seed;
    }

    public double getOriginLat() {
      return originLat;
    }

    public void setOriginLat(double originLat) {
      this.originLat = originLat;
    }

    public double getOriginLon() {
      return originLon;
    }

    public void setOriginLon(double originLon) {
      this.originLon = originLon;
    }
  }
}
