package com.roadassist.geo.model;

/**
 * A workshop candidate for discovery. {@code distanceKm} is null until ranked against an origin,
 * and stays null when the caller gave no origin.
 */
public record NearbyWorkshop(
        Long id,
        String name,
        String description,
        String address,
        String phone,
        double latitude,
        double longitude,
        Double rating,
        Integer reviewCount,
        Double distanceKm
) {

    public NearbyWorkshop withDistance(Double distanceKm) {
        return new NearbyWorkshop(id, name, description, address, phone,
                latitude, longitude, rating, reviewCount, distanceKm);
    }
}
