package com.roadassist.geo.model;

import com.roadassist.common.exception.BusinessException;
import com.roadassist.common.exception.ErrorCode;

public record GeoPoint(double latitude, double longitude) {

    /**
     * Validated factory. Both coordinates must be present and within WGS84 range.
     */
    public static GeoPoint of(Double latitude, Double longitude) {
        if (latitude == null || longitude == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Latitude and longitude are required");
        }
        if (latitude.isNaN() || longitude.isNaN()
                || latitude < -90 || latitude > 90 || longitude < -180 || longitude > 180) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Invalid latitude or longitude values");
        }
        return new GeoPoint(latitude, longitude);
    }

    /**
     * Like {@link #of} but returns null when both coordinates are absent.
     */
    public static GeoPoint ofNullable(Double latitude, Double longitude) {
        if (latitude == null && longitude == null) {
            return null;
        }
        return of(latitude, longitude);
    }
}
