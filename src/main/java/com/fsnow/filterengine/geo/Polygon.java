package com.fsnow.filterengine.geo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Simple polygon on the lat/lon plane. Vertices on the edges count as inside.
 */
public class Polygon extends GeoShape {
    
    private static final double EPSILON = 1e-12;
    
    private final List<GeoPoint> vertices;
    
    public Polygon(List<GeoPoint> vertices) {
        if (vertices.size() < 3) {
            throw new IllegalArgumentException("A polygon requires at least 3 points");
        }
        this.vertices = Collections.unmodifiableList(new ArrayList<>(vertices));
    }
    
    @Override
    public boolean contains(GeoPoint point) {
        double x = point.getLon();
        double y = point.getLat();
        boolean inside = false;
        
        for (int i = 0, j = vertices.size() - 1; i < vertices.size(); j = i++) {
            double xi = vertices.get(i).getLon(), yi = vertices.get(i).getLat();
            double xj = vertices.get(j).getLon(), yj = vertices.get(j).getLat();
            
            if (onSegment(x, y, xi, yi, xj, yj)) {
                return true;
            }
            
            if ((yi > y) != (yj > y) && x < (xj - xi) * (y - yi) / (yj - yi) + xi) {
                inside = !inside;
            }
        }
        
        return inside;
    }
    
    private static boolean onSegment(double x, double y, double x1, double y1, double x2, double y2) {
        double cross = (x - x1) * (y2 - y1) - (y - y1) * (x2 - x1);
        if (Math.abs(cross) > EPSILON) {
            return false;
        }
        return x >= Math.min(x1, x2) - EPSILON && x <= Math.max(x1, x2) + EPSILON
                && y >= Math.min(y1, y2) - EPSILON && y <= Math.max(y1, y2) + EPSILON;
    }
    
    @Override
    public String toString() {
        return "Polygon" + vertices;
    }
}
