package com.fsnow.filterengine.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A compiled regular expression along with the DSL flags it was declared with.
 * <p>
 * Supported flags: {@code i} (case insensitive), {@code m} (multiline),
 * {@code s} (dot matches line terminators), {@code u} (unicode case folding)
 * and {@code g}, which is accepted but has no effect on a boolean test.
 */
public final class RegexpPattern implements Comparable<RegexpPattern> {

    private final String value;
    private final String flags;
    private final Pattern pattern;

    private RegexpPattern(String value, String flags, Pattern pattern) {
        this.value = value;
        this.flags = flags;
        this.pattern = pattern;
    }

    /**
     * Compiles a pattern.
     *
     * @param value The regular expression
     * @param flags The flags, may be null
     * @throws IllegalArgumentException if a flag is unsupported or the expression is invalid
     */
    public static RegexpPattern compile(String value, String flags) {
        Objects.requireNonNull(value, "Regular expression cannot be null");
        String normalizedFlags = flags == null ? "" : flags;
        int javaFlags = 0;

        for (char flag : normalizedFlags.toCharArray()) {
            switch (flag) {
                case 'i':
                    javaFlags |= Pattern.CASE_INSENSITIVE;
                    break;
                case 'm':
                    javaFlags |= Pattern.MULTILINE;
                    break;
                case 's':
                    javaFlags |= Pattern.DOTALL;
                    break;
                case 'u':
                    javaFlags |= Pattern.UNICODE_CASE;
                    break;
                case 'g':
                    break;
                default:
                    throw new IllegalArgumentException("Invalid regular expression flag: " + flag);
            }
        }

        return new RegexpPattern(value, normalizedFlags, Pattern.compile(value, javaFlags));
    }

    public String getValue() {
        return value;
    }

    public String getFlags() {
        return flags;
    }

    /**
     * Checks if the pattern is found anywhere in the input.
     */
    public boolean test(String input) {
        return pattern.matcher(input).find();
    }

    /**
     * Patterns are ordered by expression, then by flags.
     */
    @Override
    public int compareTo(RegexpPattern other) {
        int cmp = value.compareTo(other.value);
        return cmp != 0 ? cmp : flags.compareTo(other.flags);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RegexpPattern that = (RegexpPattern) o;
        return value.equals(that.value) && flags.equals(that.flags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, flags);
    }

    @Override
    public String toString() {
        return "/" + value + "/" + flags;
    }
}
