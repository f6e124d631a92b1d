package com.fsnow.filterengine.geo;

/**
 * Points within a distance (in meters) of a center.
 */
public class Circle extends GeoShape {
    
    private final GeoPoint center;
    private final double radius;
    
    public Circle(GeoPoint center, double radius) {
        this.center = center;
        this.radius = radius;
    }
    
    @Override
    public boolean contains(GeoPoint point) {
        return center.distanceTo(point) <= radius;
    }
    
    @Override
    public String toString() {
        return String.format("Circle{center=%s, radius=%s}", center, radius);
    }
}
