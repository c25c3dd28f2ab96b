package org.drinkmap.query;

/**
 * A closed numeric interval {@code [min, max]}.
 *
 * @param min Lower bound, inclusive.
 * @param max Upper bound, inclusive.
 */
public record Range(double min, double max) {

    public Range {
        if (Double.isNaN(min) || Double.isNaN(max)) {
            throw new IllegalArgumentException("Range bounds must be numbers, got [" + min + ", " + max + "]");
        }
        if (min > max) {
            throw new IllegalArgumentException("Range minimum " + min + " is greater than maximum " + max);
        }
    }

    public static Range of(final double min, final double max) {
        return new Range(min, max);
    }

    /**
     * @return The lower bound as a Long when it is integral, otherwise as a Double.
     */
    public Number minValue() {
        return asNumber(min);
    }

    /**
     * @return The upper bound as a Long when it is integral, otherwise as a Double.
     */
    public Number maxValue() {
        return asNumber(max);
    }

    private static Number asNumber(final double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < Long.MAX_VALUE) {
            return (long) value;
        }
        return value;
    }
}
