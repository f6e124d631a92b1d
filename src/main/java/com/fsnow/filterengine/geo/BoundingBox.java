package com.fsnow.filterengine.geo;

/**
 * Latitude/longitude aligned box. A box whose left edge lies east of its
 * right edge crosses the antimeridian.
 */
public class BoundingBox extends GeoShape {
    
    private final double top;
    private final double left;
    private final double bottom;
    private final double right;
    
    public BoundingBox(double top, double left, double bottom, double right) {
        this.top = top;
        this.left = left;
        this.bottom = bottom;
        this.right = right;
    }
    
    @Override
    public boolean contains(GeoPoint point) {
        double lat = point.getLat();
        double lon = point.getLon();
        
        if (lat < Math.min(top, bottom) || lat > Math.max(top, bottom)) {
            return false;
        }
        
        if (left <= right) {
            return lon >= left && lon <= right;
        }
        return lon >= left || lon <= right;
    }
    
    @Override
    public String toString() {
        return String.format("BoundingBox{top=%s, left=%s, bottom=%s, right=%s}", top, left, bottom, right);
    }
}
