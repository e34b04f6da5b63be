package com.amannmalik.money.util;

import java.util.Objects;

/**
 * Small collection of reusable argument guards. Domain failures have their own exception types;
 * these cover plain programming errors such as nulls and out-of-range parameters.
 */
public final class Ensure {
    private Ensure() {
    }

    public static <T> T notNull(String field, T value) {
        return Objects.requireNonNull(value, field + " MUST NOT be null");
    }

    public static int inRange(String field, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(field + " MUST be between " + min + " and " + max);
        }
        return value;
    }
}
