package com.fsnow.filterengine.geo;

import java.util.Objects;

/**
 * A latitude/longitude pair in decimal degrees.
 */
public final class GeoPoint {
    
    private static final double EARTH_RADIUS_METERS = 6371008.8;
    
    private final double lat;
    private final double lon;
    
    public GeoPoint(double lat, double lon) {
        this.lat = lat;
        this.lon = lon;
    }
    
    public double getLat() {
        return lat;
    }
    
    public double getLon() {
        return lon;
    }
    
    /**
     * Great-circle distance to another point, in meters (haversine formula).
     */
    public double distanceTo(GeoPoint other) {
        double lat1 = Math.toRadians(lat);
        double lat2 = Math.toRadians(other.lat);
        double dlat = lat2 - lat1;
        double dlon = Math.toRadians(other.lon - lon);
        
        double a = Math.pow(Math.sin(dlat / 2), 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.pow(Math.sin(dlon / 2), 2);
        return 2 * EARTH_RADIUS_METERS * Math.asin(Math.min(1, Math.sqrt(a)));
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GeoPoint geoPoint = (GeoPoint) o;
        return Double.compare(geoPoint.lat, lat) == 0 && Double.compare(geoPoint.lon, lon) == 0;
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(lat, lon);
    }
    
    @Override
    public String toString() {
        return String.format("GeoPoint{lat=%s, lon=%s}", lat, lon);
    }
}
