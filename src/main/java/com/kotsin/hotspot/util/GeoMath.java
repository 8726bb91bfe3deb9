package com.kotsin.hotspot.util;

/**
 * Great-circle geometry on a spherical Earth.
 */
public final class GeoMath {

    /**
     * Mean Earth radius in kilometres
     */
    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoMath() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Haversine distance between two lat/lon points, in kilometres.
     */
    public static double haversineKm(double aLat, double aLon, double bLat, double bLon) {
        double dLat = Math.toRadians(bLat - aLat);
        double dLon = Math.toRadians(bLon - aLon);
        double lat1 = Math.toRadians(aLat);
        double lat2 = Math.toRadians(bLat);

        double sinLat = Math.sin(dLat / 2);
        double sinLon = Math.sin(dLon / 2);
        double h = sinLat * sinLat + Math.cos(lat1) * Math.cos(lat2) * sinLon * sinLon;

        // rounding can push h a hair past 1 for antipodal points
        return 2 * EARTH_RADIUS_KM * Math.asin(Math.sqrt(Math.min(1.0, h)));
    }
}
