package com.securityops.coordination.util;

/**
 * Spherical-earth distance helpers used by geofence evaluation.
 */
public final class GeoMath {

    public static final double EARTH_RADIUS_METERS = 6371e3;

    private GeoMath() {
    }

    /**
     * Great-circle distance between two WGS84 points using the haversine formula.
     *
     * @return distance in meters
     */
    public static double haversineMeters(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double deltaPhi = Math.toRadians(lat2 - lat1);
        double deltaLambda = Math.toRadians(lon2 - lon1);

        double a = Math.sin(deltaPhi / 2) * Math.sin(deltaPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(deltaLambda / 2) * Math.sin(deltaLambda / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_METERS * c;
    }

    /**
     * Latitude reached by moving {@code meters} due north (negative for south) from {@code latitude}.
     * Used to build geofences and test fixtures at known distances.
     */
    public static double offsetLatitude(double latitude, double meters) {
        return latitude + Math.toDegrees(meters / EARTH_RADIUS_METERS);
    }
}
