package com.roadassist.geo.model;

import java.util.Locale;

public enum SortKey {
    DISTANCE,
    RATING,
    REVIEWS;

    /**
     * Lenient parse of query parameters: blank or unknown values fall back to {@link #DISTANCE}.
     */
    public static SortKey from(String value) {
        if (value == null || value.isBlank()) {
            return DISTANCE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return DISTANCE;
        }
    }
}
