package com.fsnow.filterengine.storage.operand;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;

/**
 * Orders scalar values (null, booleans, numbers and strings).
 * <p>
 * Values of different kinds are ordered by kind: null, then booleans, then
 * numbers, then strings. Numbers compare by exact numeric value, whatever
 * their boxed type, so {@code 1}, {@code 1L} and {@code 1.0} are equal while
 * {@code 9007199254740993L} and {@code 9007199254740992.0} are not.
 */
public final class ScalarComparator implements Comparator<Object> {

    public static final ScalarComparator INSTANCE = new ScalarComparator();

    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private ScalarComparator() {}

    /**
     * Checks if a value is a scalar this comparator can order.
     */
    public static boolean isScalar(Object value) {
        return value == null || value instanceof Boolean || value instanceof Number || value instanceof String;
    }

    public static boolean areEqual(Object a, Object b) {
        return isScalar(a) && isScalar(b) && INSTANCE.compare(a, b) == 0;
    }

    /**
     * Returns a key whose equals/hashCode agree with this comparator,
     * for use in hash-based lookups.
     * <p>
     * Numbers map to a {@code Long} when their value is integral and fits,
     * otherwise to a {@code Double} when that double holds the exact value,
     * otherwise to a stripped {@code BigDecimal}.
     */
    public static Object lookupKey(Object value) {
        if (!(value instanceof Number)) {
            return value;
        }

        Number number = (Number) value;
        if (isIntegral(number)) {
            return number.longValue();
        }

        BigDecimal exact = exact(number);
        if (exact == null) {
            return number.doubleValue();
        }

        exact = exact.stripTrailingZeros();
        if (exact.scale() <= 0 && exact.compareTo(LONG_MIN) >= 0 && exact.compareTo(LONG_MAX) <= 0) {
            return exact.longValue();
        }

        double approximation = exact.doubleValue();
        if (new BigDecimal(approximation).compareTo(exact) == 0) {
            return approximation;
        }
        return exact;
    }

    /**
     * Returns the single representation stored in filters for a scalar value:
     * numbers that compare equal get the same boxed type and value, integral
     * values within the int range being kept as {@code Integer}.
     */
    public static Object canonicalValue(Object value) {
        Object key = lookupKey(value);

        if (key instanceof Long) {
            long number = (Long) key;
            if (number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
                return (int) number;
            }
        }
        return key;
    }

    @Override
    public int compare(Object a, Object b) {
        int kindA = kind(a);
        int kindB = kind(b);

        if (kindA != kindB) {
            return Integer.compare(kindA, kindB);
        }

        switch (kindA) {
            case 0:
                return 0;
            case 1:
                return Boolean.compare((Boolean) a, (Boolean) b);
            case 2:
                return compareNumbers((Number) a, (Number) b);
            case 3:
                return ((String) a).compareTo((String) b);
            default:
                throw new IllegalArgumentException("Not a scalar value: " + a);
        }
    }

    private static int compareNumbers(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return Long.compare(a.longValue(), b.longValue());
        }

        BigDecimal x = exact(a);
        BigDecimal y = exact(b);
        if (x != null && y != null) {
            return x.compareTo(y);
        }

        // NaN or an infinity on one side
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    /**
     * Exact decimal value of a number, or null for NaN and infinities.
     */
    private static BigDecimal exact(Number n) {
        if (n instanceof BigDecimal) {
            return (BigDecimal) n;
        }
        if (isIntegral(n)) {
            return BigDecimal.valueOf(n.longValue());
        }
        if (n instanceof BigInteger) {
            return new BigDecimal((BigInteger) n);
        }

        double d = n.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return null;
        }
        return new BigDecimal(d);
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
    }

    private static int kind(Object value) {
        if (value == null) return 0;
        if (value instanceof Boolean) return 1;
        if (value instanceof Number) return 2;
        if (value instanceof String) return 3;
        return 4;
    }
}
