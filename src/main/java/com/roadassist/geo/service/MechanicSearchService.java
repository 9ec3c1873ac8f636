package com.roadassist.geo.service;

import com.roadassist.common.exception.ErrorCode;
import com.roadassist.geo.model.GeoPoint;
import com.roadassist.geo.model.PlaceFilter;
import com.roadassist.geo.model.PlaceResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * External mechanic discovery around a point.
 *
 * <p>Multi-term searches run one provider call per term concurrently on the search executor.
 * A failing term yields an empty bucket and is logged; the remaining buckets are merged by
 * {@link GeoRankingService#mergeExternalResults}.</p>
 */
@Slf4j
@Service
public class MechanicSearchService {

    static final int PER_TERM_RESULTS = 10;
    static final int DEFAULT_MAX_RESULTS = 20;
    static final String DEFAULT_QUERY = "Mechanic";

    private final PlaceSearchGateway placeSearchGateway;
    private final GeoRankingService geoRankingService;
    private final Executor searchExecutor;
    private final List<String> defaultTerms;

    public MechanicSearchService(PlaceSearchGateway placeSearchGateway,
                                 GeoRankingService geoRankingService,
                                 @Qualifier("searchExecutor") Executor searchExecutor,
                                 @Value("${roadassist.place-search.default-terms:Mechanic,Auto Repair,Car Service}")
                                 List<String> defaultTerms) {
        this.placeSearchGateway = placeSearchGateway;
        this.geoRankingService = geoRankingService;
        this.searchExecutor = searchExecutor;
        this.defaultTerms = List.copyOf(defaultTerms);
    }

    /**
     * Searches every term and merges the buckets. An empty term list searches the configured
     * default terms.
     */
    public List<PlaceResult> searchMany(GeoPoint origin, List<String> terms) {
        List<String> effectiveTerms = sanitize(terms);
        if (effectiveTerms.isEmpty()) {
            effectiveTerms = defaultTerms;
        }

        List<CompletableFuture<List<PlaceResult>>> futures = new ArrayList<>(effectiveTerms.size());
        for (String term : effectiveTerms) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> placeSearchGateway.search(term, origin, PER_TERM_RESULTS), searchExecutor)
                    .exceptionally(ex -> {
                        log.warn("Search bucket failed, continuing without it: term={}, cause={}",
                                term, rootMessage(ex));
                        return List.of();
                    }));
        }

        List<List<PlaceResult>> buckets = new ArrayList<>(futures.size());
        for (CompletableFuture<List<PlaceResult>> future : futures) {
            buckets.add(future.join());
        }
        List<PlaceResult> merged = geoRankingService.mergeExternalResults(buckets, origin);
        log.info("Merged mechanic search: terms={}, results={}", effectiveTerms, merged.size());
        return merged;
    }

    /**
     * Single-term search ranked by distance. Provider failure surfaces as
     * {@link ErrorCode#PLACE_SEARCH_UNAVAILABLE}.
     */
    public List<PlaceResult> searchOne(GeoPoint origin, String query, Integer maxResults) {
        String term = query == null || query.isBlank() ? DEFAULT_QUERY : query.trim();
        int limit = maxResults == null || maxResults <= 0 ? DEFAULT_MAX_RESULTS : maxResults;
        List<PlaceResult> results = placeSearchGateway.search(term, origin, limit);
        return geoRankingService.rankByDistance(results, origin, limit);
    }

    public List<PlaceResult> searchFiltered(GeoPoint origin, String query, PlaceFilter filter) {
        List<PlaceResult> ranked = searchOne(origin, query, DEFAULT_MAX_RESULTS);
        return geoRankingService.filterAndSort(ranked, filter);
    }

    private List<String> sanitize(List<String> terms) {
        if (terms == null) {
            return List.of();
        }
        List<String> cleaned = new ArrayList<>();
        for (String term : terms) {
            if (term != null && !term.isBlank()) {
                cleaned.add(term.trim());
            }
        }
        return cleaned;
    }

    private static String rootMessage(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        return cause.getMessage();
    }
}
