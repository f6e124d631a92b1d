package com.fsnow.filterengine.transformation;

/**
 * A product term over a fixed number of boolean variables.
 * <p>
 * Variable {@code i} is bit {@code i}. A bit set in {@code mask} marks the
 * variable as "don't care"; otherwise the variable is asserted when its bit
 * is set in {@code value}, and negated when it is not.
 */
public final class Implicant {

    private final int variableCount;
    private final long value;
    private final long mask;

    Implicant(int variableCount, long value, long mask) {
        this.variableCount = variableCount;
        this.mask = mask;
        this.value = value & ~mask;
    }

    public int getVariableCount() {
        return variableCount;
    }

    public long getValue() {
        return value;
    }

    public long getMask() {
        return mask;
    }

    public boolean isDontCare(int variable) {
        return (mask & (1L << variable)) != 0;
    }

    public boolean isAsserted(int variable) {
        return (value & (1L << variable)) != 0;
    }

    /**
     * Checks if this implicant covers the given row of the truth table.
     */
    public boolean covers(long minterm) {
        return (minterm & ~mask) == value;
    }

    public int literalCount() {
        return variableCount - Long.bitCount(mask);
    }

    /**
     * An implicant without any literal is always true.
     */
    public boolean isTautology() {
        return literalCount() == 0;
    }

    Implicant combine(int variable) {
        return new Implicant(variableCount, value, mask | (1L << variable));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Implicant that = (Implicant) o;
        return variableCount == that.variableCount && value == that.value && mask == that.mask;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value * 31 + mask) * 31 + variableCount;
    }

    /**
     * Renders the implicant as a row, first variable first: {@code 1} asserted,
     * {@code 0} negated, {@code -} don't care.
     */
    @Override
    public String toString() {
        StringBuilder row = new StringBuilder(variableCount);
        for (int i = 0; i < variableCount; i++) {
            row.append(isDontCare(i) ? '-' : isAsserted(i) ? '1' : '0');
        }
        return row.toString();
    }
}
