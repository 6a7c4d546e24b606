package com.skytrack.tracker.engine;

import com.skytrack.tracker.model.GeoPosition;

/** Spherical-earth helpers working in nautical miles and true degrees. */
public final class GreatCircle {
  public static final double EARTH_RADIUS_NM = 3440.065;

  private GreatCircle() {}

  /** Haversine distance between two positions in nautical miles. */
  public static double distanceNm(GeoPosition from, GeoPosition to) {
    double lat1 = Math.toRadians(from.lat());
    double lat2 = Math.toRadians(to.lat());
    double dLat = lat2 - lat1;
    double dLon = Math.toRadians(to.lon() - from.lon());

    double a = Math.pow(Math.sin(dLat / 2), 2)
        + Math.cos(lat1) * Math.cos(lat2) * Math.pow(Math.sin(dLon / 2), 2);
    return EARTH_RADIUS_NM * 2 * Math.asin(Math.sqrt(a));
  }

  /** Initial bearing from {@code from} to {@code to}, normalized to {@code [0, 360)}. */
  public static double initialBearingDeg(GeoPosition from, GeoPosition to) {
    double lat1 = Math.toRadians(from.lat());
    double lat2 = Math.toRadians(to.lat());
    double dLon = Math.toRadians(to.lon() - from.lon());

    double y = Math.sin(dLon) * Math.cos(lat2);
    double x = Math.cos(lat1) * Math.sin(lat2) - Math.sin(lat1) * Math.cos(lat2) * Math.cos(dLon);
    return normalizeDeg(Math.toDegrees(Math.atan2(y, x)));
  }

  /** Position reached after travelling {@code distanceNm} along {@code bearingDeg}. */
  public static GeoPosition destination(GeoPosition start, double bearingDeg, double distanceNm) {
    double lat1 = Math.toRadians(start.lat());
    double lon1 = Math.toRadians(start.lon());
    double bearing = Math.toRadians(bearingDeg);
    double angular = distanceNm / EARTH_RADIUS_NM;

    double lat2 = Math.asin(Math.sin(lat1) * Math.cos(angular)
        + Math.cos(lat1) * Math.sin(angular) * Math.cos(bearing));
    double lon2 = lon1 + Math.atan2(
        Math.sin(bearing) * Math.sin(angular) * Math.cos(lat1),
        Math.cos(angular) - Math.sin(lat1) * Math.sin(lat2));
    return new GeoPosition(Math.toDegrees(lat2), normalizeLon(Math.toDegrees(lon2)));
  }

  /** Smallest absolute difference between two headings, in {@code [0, 180]}. */
  public static double angleBetweenDeg(double a, double b) {
    double diff = Math.abs(normalizeDeg(a) - normalizeDeg(b));
    return diff > 180.0 ? 360.0 - diff : diff;
  }

  static double normalizeDeg(double deg) {
    double normalized = deg % 360.0;
    return normalized < 0 ? normalized + 360.0 : normalized;
  }

  private static double normalizeLon(double lon) {
    return ((lon + 540.0) % 360.0) - 180.0;
  }
}
