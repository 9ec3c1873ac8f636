package com.roadassist.geo.service;

import com.roadassist.geo.model.GeoPoint;
import com.roadassist.geo.model.NearbyWorkshop;
import com.roadassist.geo.model.PlaceFilter;
import com.roadassist.geo.model.PlaceResult;
import com.roadassist.geo.model.SortKey;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Distance computation and ordering of discovery candidates. Stateless; every sort is stable.
 */
@Service
public class GeoRankingService {

    static final double EARTH_RADIUS_KM = 6371.0;
    static final int MERGED_RESULT_LIMIT = 20;
    static final double DISTANCE_WEIGHT = 0.7;
    static final double RATING_WEIGHT = 0.3;

    /**
     * Great-circle (haversine) distance in kilometres, rounded to one decimal place.
     */
    public static double distanceKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return Math.round(EARTH_RADIUS_KM * c * 10) / 10.0;
    }

    public static double distanceKm(GeoPoint from, GeoPoint to) {
        return distanceKm(from.latitude(), from.longitude(), to.latitude(), to.longitude());
    }

    /**
     * Ranks workshops around the user.
     *
     * <p>With an origin every candidate gets a distance, candidates beyond {@code radiusKm}
     * (when given) are dropped and the list is ordered by {@code sortKey}: ascending distance
     * or descending rating. Without an origin distances stay null, no radius applies and the
     * list is ordered by rating.</p>
     */
    public List<NearbyWorkshop> rankNearby(GeoPoint origin, Collection<NearbyWorkshop> candidates,
                                           SortKey sortKey, Double radiusKm) {
        List<NearbyWorkshop> ranked = new ArrayList<>(candidates.size());
        for (NearbyWorkshop candidate : candidates) {
            if (origin == null) {
                ranked.add(candidate.withDistance(null));
                continue;
            }
            double distance = distanceKm(origin.latitude(), origin.longitude(),
                    candidate.latitude(), candidate.longitude());
            if (radiusKm == null || distance <= radiusKm) {
                ranked.add(candidate.withDistance(distance));
            }
        }

        if (origin != null && sortKey != SortKey.RATING) {
            ranked.sort(Comparator.comparingDouble(NearbyWorkshop::distanceKm));
        } else {
            ranked.sort(Comparator.comparingDouble((NearbyWorkshop w) -> orZero(w.rating())).reversed());
        }
        return ranked;
    }

    /**
     * Merges per-term search buckets into one list.
     *
     * <p>Results are de-duplicated by external id with the first occurrence winning (results
     * without an id are all kept), measured from the user, ordered by
     * {@code 0.7 * distance - 0.3 * rating} ascending with missing values read as zero, and
     * truncated to {@value #MERGED_RESULT_LIMIT}.</p>
     */
    public List<PlaceResult> mergeExternalResults(List<List<PlaceResult>> buckets, GeoPoint origin) {
        Set<String> seenIds = new HashSet<>();
        List<PlaceResult> merged = new ArrayList<>();
        for (List<PlaceResult> bucket : buckets) {
            if (bucket == null) {
                continue;
            }
            for (PlaceResult result : bucket) {
                if (result.externalId() != null && !seenIds.add(result.externalId())) {
                    continue;
                }
                merged.add(withDistanceFrom(result, origin));
            }
        }

        merged.sort(Comparator.comparingDouble(GeoRankingService::weightedScore));
        return merged.size() > MERGED_RESULT_LIMIT
                ? new ArrayList<>(merged.subList(0, MERGED_RESULT_LIMIT))
                : merged;
    }

    /**
     * Single-term ranking: distance from the user, ascending, missing distances first.
     */
    public List<PlaceResult> rankByDistance(List<PlaceResult> results, GeoPoint origin, int limit) {
        List<PlaceResult> ranked = new ArrayList<>(results.size());
        for (PlaceResult result : results) {
            ranked.add(withDistanceFrom(result, origin));
        }
        ranked.sort(Comparator.comparingDouble(r -> orZero(r.distanceKm())));
        return ranked.size() > limit ? new ArrayList<>(ranked.subList(0, limit)) : ranked;
    }

    /**
     * Applies the optional filters to already ranked results, then re-orders them by
     * {@link PlaceFilter#sortBy()}.
     */
    public List<PlaceResult> filterAndSort(List<PlaceResult> ranked, PlaceFilter filter) {
        List<PlaceResult> filtered = new ArrayList<>();
        for (PlaceResult result : ranked) {
            if (filter.minRating() != null && orZero(result.rating()) < filter.minRating()) {
                continue;
            }
            if (filter.maxDistanceKm() != null && orZero(result.distanceKm()) > filter.maxDistanceKm()) {
                continue;
            }
            if (filter.priceRange() != null && !filter.priceRange().isBlank()
                    && !Objects.equals(filter.priceRange(), result.price())) {
                continue;
            }
            filtered.add(result);
        }

        switch (filter.sortBy()) {
            case RATING -> filtered.sort(
                    Comparator.comparingDouble((PlaceResult r) -> orZero(r.rating())).reversed());
            case REVIEWS -> filtered.sort(
                    Comparator.comparingInt((PlaceResult r) -> r.reviewCount() == null ? 0 : r.reviewCount()).reversed());
            case DISTANCE -> filtered.sort(Comparator.comparingDouble(r -> orZero(r.distanceKm())));
        }
        return filtered;
    }

    static double weightedScore(PlaceResult result) {
        return DISTANCE_WEIGHT * orZero(result.distanceKm()) - RATING_WEIGHT * orZero(result.rating());
    }

    private static PlaceResult withDistanceFrom(PlaceResult result, GeoPoint origin) {
        if (origin == null || !result.hasCoordinates()) {
            return result;
        }
        return result.withDistance(distanceKm(origin.latitude(), origin.longitude(),
                result.latitude(), result.longitude()));
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
