package com.fsnow.filterengine.geo;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the accepted geo-point encodings to {@link GeoPoint}.
 * <p>
 * Accepted formats:
 * <ul>
 *   <li>{@code {lat: 43.6, lon: 3.8}}</li>
 *   <li>{@code {latLon: {lat: 43.6, lon: 3.8}}} (or {@code lat_lon})</li>
 *   <li>{@code {latLon: [43.6, 3.8]}}</li>
 *   <li>{@code {latLon: "43.6, 3.8"}}</li>
 *   <li>{@code {latLon: "spf8prntv18e"}} (geohash)</li>
 *   <li>{@code [43.6, 3.8]}, {@code "43.6, 3.8"} and {@code "spf8prntv18e"}</li>
 * </ul>
 */
public final class GeoPoints {
    
    public static final Pattern LAT_LON_STRING = Pattern.compile("^([-+]?\\d*\\.?\\d+),\\s*([-+]?\\d*\\.?\\d+)$");
    public static final Pattern GEOHASH_STRING = Pattern.compile("^[0-9a-z]{4,}$");
    
    private GeoPoints() {}
    
    /**
     * Parses a geo-point.
     *
     * @param value The raw value, as found in a filter or a document
     * @return the point, or empty if the value is not a recognized geo-point
     */
    public static Optional<GeoPoint> parse(Object value) {
        if (value instanceof String) {
            return parseString((String) value);
        }
        
        if (value instanceof List) {
            return parseArray((List<?>) value);
        }
        
        if (value instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) value;
            
            if (map.get("lat") instanceof Number && map.get("lon") instanceof Number) {
                return Optional.of(new GeoPoint(((Number) map.get("lat")).doubleValue(),
                        ((Number) map.get("lon")).doubleValue()));
            }
            
            if (map.size() == 1) {
                Object latLon = map.containsKey("latLon") ? map.get("latLon") : map.get("lat_lon");
                if (latLon instanceof Map) {
                    Map<?, ?> inner = (Map<?, ?>) latLon;
                    if (inner.get("lat") instanceof Number && inner.get("lon") instanceof Number) {
                        return Optional.of(new GeoPoint(((Number) inner.get("lat")).doubleValue(),
                                ((Number) inner.get("lon")).doubleValue()));
                    }
                    return Optional.empty();
                }
                if (latLon != null) {
                    return parse(latLon);
                }
            }
        }
        
        return Optional.empty();
    }
    
    /**
     * Parses a "lat, lon" string or a geohash.
     */
    public static Optional<GeoPoint> parseString(String value) {
        Matcher matcher = LAT_LON_STRING.matcher(value);
        if (matcher.matches()) {
            return Optional.of(new GeoPoint(Double.parseDouble(matcher.group(1)),
                    Double.parseDouble(matcher.group(2))));
        }
        
        if (GEOHASH_STRING.matcher(value).matches() && GeoHash.isValid(value)) {
            return Optional.of(GeoHash.decode(value));
        }
        
        return Optional.empty();
    }
    
    /**
     * Parses a [lat, lon] array.
     */
    public static Optional<GeoPoint> parseArray(List<?> value) {
        if (value.size() == 2 && value.get(0) instanceof Number && value.get(1) instanceof Number) {
            return Optional.of(new GeoPoint(((Number) value.get(0)).doubleValue(),
                    ((Number) value.get(1)).doubleValue()));
        }
        return Optional.empty();
    }
}
