package com.roadassist.geo.model;

/**
 * Optional filters for a single-term place search. Null fields do not filter.
 */
public record PlaceFilter(Double minRating, Double maxDistanceKm, String priceRange, SortKey sortBy) {

    public PlaceFilter {
        if (sortBy == null) {
            sortBy = SortKey.DISTANCE;
        }
    }
}
