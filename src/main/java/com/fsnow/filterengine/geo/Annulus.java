package com.fsnow.filterengine.geo;

/**
 * Ring between two distances (in meters) around a center.
 */
public class Annulus extends GeoShape {
    
    private final GeoPoint center;
    private final double innerRadius;
    private final double outerRadius;
    
    public Annulus(GeoPoint center, double innerRadius, double outerRadius) {
        this.center = center;
        this.innerRadius = innerRadius;
        this.outerRadius = outerRadius;
    }
    
    @Override
    public boolean contains(GeoPoint point) {
        double distance = center.distanceTo(point);
        return distance >= innerRadius && distance <= outerRadius;
    }
    
    @Override
    public String toString() {
        return String.format("Annulus{center=%s, from=%s, to=%s}", center, innerRadius, outerRadius);
    }
}
