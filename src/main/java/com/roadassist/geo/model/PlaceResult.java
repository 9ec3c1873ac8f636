package com.roadassist.geo.model;

/**
 * One place returned by the external search provider, normalized.
 *
 * @param externalId provider-side identifier, may be null
 * @param distanceKm distance from the searching user, null until ranked
 */
public record PlaceResult(
        String externalId,
        String name,
        String address,
        Double latitude,
        Double longitude,
        Double rating,
        Integer reviewCount,
        String price,
        String type,
        String phone,
        Double distanceKm
) {

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }

    public PlaceResult withDistance(Double distanceKm) {
        return new PlaceResult(externalId, name, address, latitude, longitude,
                rating, reviewCount, price, type, phone, distanceKm);
    }
}
