package com.fsnow.filterengine.geo;

import org.bson.Document;

import java.util.ArrayList;
import java.util.List;

/**
 * A registered geospatial shape, tested against document points.
 */
public abstract class GeoShape {
    
    public static final String BOUNDING_BOX = "geoBoundingBox";
    public static final String DISTANCE = "geoDistance";
    public static final String DISTANCE_RANGE = "geoDistanceRange";
    public static final String POLYGON = "geoPolygon";
    
    /**
     * Checks if the point lies in this shape, boundaries included.
     */
    public abstract boolean contains(GeoPoint point);
    
    /**
     * Builds a shape from its standardized representation.
     *
     * @param type One of the geo keyword names
     * @param shape The standardized shape payload
     * @throws IllegalArgumentException if the type is unknown
     */
    public static GeoShape fromStandardized(String type, Object shape) {
        switch (type) {
            case BOUNDING_BOX: {
                Document box = (Document) shape;
                return new BoundingBox(number(box, "top"), number(box, "left"),
                        number(box, "bottom"), number(box, "right"));
            }
            case DISTANCE: {
                Document circle = (Document) shape;
                return new Circle(new GeoPoint(number(circle, "lat"), number(circle, "lon")),
                        number(circle, "distance"));
            }
            case DISTANCE_RANGE: {
                Document annulus = (Document) shape;
                return new Annulus(new GeoPoint(number(annulus, "lat"), number(annulus, "lon")),
                        number(annulus, "from"), number(annulus, "to"));
            }
            case POLYGON: {
                List<GeoPoint> points = new ArrayList<>();
                for (Object point : (List<?>) shape) {
                    List<?> coordinates = (List<?>) point;
                    points.add(new GeoPoint(((Number) coordinates.get(0)).doubleValue(),
                            ((Number) coordinates.get(1)).doubleValue()));
                }
                return new Polygon(points);
            }
            default:
                throw new IllegalArgumentException("Unknown geospatial shape type: " + type);
        }
    }
    
    private static double number(Document document, String key) {
        return ((Number) document.get(key)).doubleValue();
    }
}
