package com.skytrack.tracker.model;

/**
 * Latitude/longitude pair in decimal degrees.
 *
 * <p>{@code (0, 0)} is the "no fix yet" sentinel carried by freshly created tracks.
 */
public record GeoPosition(double lat, double lon) {
  public static final GeoPosition UNSET = new GeoPosition(0.0, 0.0);

  public boolean isUnset() {
    return lat == 0.0 && lon == 0.0;
  }
}
