package com.fsnow.filterengine.geo;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts distance strings such as "500m", "12.5 km" or "3 258,55 Ft" to meters.
 * A distance without a unit is read as meters.
 */
public final class DistanceConverter {
    
    private static final Pattern DISTANCE = Pattern.compile("^(\\d*\\.?\\d+)([a-z]*)$");
    
    private static final Map<String, Double> UNITS = new HashMap<>();
    
    static {
        register(1, "", "m", "meter", "meters", "metre", "metres");
        register(1000, "km", "kilometer", "kilometers", "kilometre", "kilometres");
        register(0.01, "cm", "centimeter", "centimeters", "centimetre", "centimetres");
        register(0.001, "mm", "millimeter", "millimeters", "millimetre", "millimetres");
        register(1609.344, "mi", "mile", "miles");
        register(0.9144, "yd", "yard", "yards");
        register(0.3048, "ft", "foot", "feet");
        register(0.0254, "in", "inch", "inches");
        register(1852, "nmi", "nauticalmile", "nauticalmiles");
    }
    
    private DistanceConverter() {}
    
    private static void register(double meters, String... names) {
        for (String name : names) {
            UNITS.put(name, meters);
        }
    }
    
    /**
     * Converts a distance to meters.
     *
     * @param distance The distance string
     * @return the distance in meters
     * @throws IllegalArgumentException if the distance cannot be parsed
     */
    public static double toMeters(String distance) {
        String cleaned = distance.trim()
                .replace(" ", "")
                .replace(',', '.')
                .toLowerCase(Locale.ROOT);
        
        if (cleaned.startsWith("-")) {
            cleaned = cleaned.substring(1);
        }
        
        Matcher matcher = DISTANCE.matcher(cleaned);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("unable to parse distance value \"" + distance + "\"");
        }
        
        Double factor = UNITS.get(matcher.group(2));
        if (factor == null) {
            throw new IllegalArgumentException("unknown distance unit \"" + matcher.group(2) + "\"");
        }
        
        return Double.parseDouble(matcher.group(1)) * factor;
    }
}
