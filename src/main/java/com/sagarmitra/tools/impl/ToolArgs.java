package com.sagarmitra.tools.impl;

import org.springframework.util.StringUtils;

/**
 * Lenient readers for model-supplied tool arguments. Models send numbers as strings often
 * enough that both forms are accepted.
 */
final class ToolArgs {

    private ToolArgs() {
    }

    /** Trimmed text, or null when absent or blank. */
    static String text(Object value) {
        if (value == null) {
            return null;
        }
        String str = value.toString().trim();
        return StringUtils.hasText(str) ? str : null;
    }

    /** Number within [-bound, bound], or null when absent. */
    static Double coordinate(Object raw, String key, double bound) {
        Double value = null;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else if (raw instanceof String str && StringUtils.hasText(str)) {
            try {
                value = Double.parseDouble(str.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be a number, got '" + str + "'");
            }
        }
        if (value != null && (value < -bound || value > bound)) {
            throw new IllegalArgumentException(key + " must be between " + (int) -bound + " and " + (int) bound);
        }
        return value;
    }

    /** Whole number of at least {@code min}, or {@code fallback} when absent. */
    static int positiveInt(Object raw, String key, int min, int fallback) {
        if (raw == null || (raw instanceof String str && !StringUtils.hasText(str))) {
            return fallback;
        }
        int value;
        if (raw instanceof Number number) {
            value = number.intValue();
        } else {
            try {
                value = (int) Double.parseDouble(raw.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be a number, got '" + raw + "'");
            }
        }
        if (value < min) {
            throw new IllegalArgumentException(key + " must be at least " + min);
        }
        return value;
    }
}
