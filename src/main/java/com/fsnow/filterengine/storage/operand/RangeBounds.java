package com.fsnow.filterengine.storage.operand;

import org.bson.Document;

/**
 * Bounds of a standardized {@code range} condition. Missing bounds are infinite.
 */
final class RangeBounds {

    final double low;
    final boolean lowInclusive;
    final double high;
    final boolean highInclusive;

    private RangeBounds(double low, boolean lowInclusive, double high, boolean highInclusive) {
        this.low = low;
        this.lowInclusive = lowInclusive;
        this.high = high;
        this.highInclusive = highInclusive;
    }

    static RangeBounds of(Document range) {
        double low = Double.NEGATIVE_INFINITY;
        boolean lowInclusive = false;
        double high = Double.POSITIVE_INFINITY;
        boolean highInclusive = false;

        if (range.get("gt") != null) {
            low = ((Number) range.get("gt")).doubleValue();
        } else if (range.get("gte") != null) {
            low = ((Number) range.get("gte")).doubleValue();
            lowInclusive = true;
        }

        if (range.get("lt") != null) {
            high = ((Number) range.get("lt")).doubleValue();
        } else if (range.get("lte") != null) {
            high = ((Number) range.get("lte")).doubleValue();
            highInclusive = true;
        }

        return new RangeBounds(low, lowInclusive, high, highInclusive);
    }
}
