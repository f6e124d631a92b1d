package com.fsnow.filterengine.geo;

/**
 * Geohash decoding.
 */
public final class GeoHash {
    
    private static final String BASE32 = "0123456789bcdefghjkmnpqrstuvwxyz";
    
    private GeoHash() {}
    
    /**
     * Checks that every character belongs to the geohash alphabet.
     */
    public static boolean isValid(String hash) {
        if (hash == null || hash.isEmpty()) {
            return false;
        }
        for (int i = 0; i < hash.length(); i++) {
            if (BASE32.indexOf(hash.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }
    
    /**
     * Decodes a geohash to the center of its cell.
     *
     * @throws IllegalArgumentException if the hash contains characters outside the alphabet
     */
    public static GeoPoint decode(String hash) {
        double minLat = -90, maxLat = 90;
        double minLon = -180, maxLon = 180;
        boolean even = true;
        
        for (int i = 0; i < hash.length(); i++) {
            int cd = BASE32.indexOf(hash.charAt(i));
            if (cd < 0) {
                throw new IllegalArgumentException("Invalid geohash character '" + hash.charAt(i) + "' in " + hash);
            }
            
            for (int mask = 16; mask > 0; mask >>= 1) {
                boolean bit = (cd & mask) != 0;
                if (even) {
                    double mid = (minLon + maxLon) / 2;
                    if (bit) {
                        minLon = mid;
                    } else {
                        maxLon = mid;
                    }
                } else {
                    double mid = (minLat + maxLat) / 2;
                    if (bit) {
                        minLat = mid;
                    } else {
                        maxLat = mid;
                    }
                }
                even = !even;
            }
        }
        
        return new GeoPoint((minLat + maxLat) / 2, (minLon + maxLon) / 2);
    }
}
