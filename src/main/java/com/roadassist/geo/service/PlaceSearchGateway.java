package com.roadassist.geo.service;

import com.roadassist.common.exception.BusinessException;
import com.roadassist.common.exception.ErrorCode;
import com.roadassist.geo.client.SerpApiClient;
import com.roadassist.geo.client.SerpApiClient.LocalResult;
import com.roadassist.geo.client.SerpApiClient.LocalSearchResponse;
import com.roadassist.geo.model.GeoPoint;
import com.roadassist.geo.model.PlaceResult;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Port to the third-party place search.
 *
 * <p>Results are cached per (term, origin, size) in Caffeine. Calls are retried and guarded by
 * the {@code placeSearch} circuit breaker; when the breaker is open or retries are exhausted the
 * call fails with {@link ErrorCode#PLACE_SEARCH_UNAVAILABLE}.</p>
 */
@Slf4j
@Component
public class PlaceSearchGateway {

    private static final String ENGINE = "google_local";
    private static final String ZOOM = "14z";

    private final SerpApiClient serpApiClient;
    private final String apiKey;

    public PlaceSearchGateway(SerpApiClient serpApiClient,
                              @Value("${roadassist.place-search.api-key:}") String apiKey) {
        this.serpApiClient = serpApiClient;
        this.apiKey = apiKey;
    }

    @Cacheable(value = "placeSearch", key = "#term + ':' + #origin.latitude() + ',' + #origin.longitude() + ':' + #maxResults")
    @Retry(name = "placeSearch")
    @CircuitBreaker(name = "placeSearch", fallbackMethod = "searchFallback")
    public List<PlaceResult> search(String term, GeoPoint origin, int maxResults) {
        String location = String.format(Locale.ROOT, "@%s,%s,%s", origin.latitude(), origin.longitude(), ZOOM);
        LocalSearchResponse response = serpApiClient.search(ENGINE, term, location, apiKey, maxResults);
        if (response == null || response.localResults() == null) {
            log.info("No places returned: term={}, origin={}", term, location);
            return List.of();
        }
        log.info("Places returned: term={}, count={}", term, response.localResults().size());

        List<PlaceResult> results = new ArrayList<>(response.localResults().size());
        for (LocalResult local : response.localResults()) {
            results.add(toPlaceResult(local));
        }
        return results;
    }

    @SuppressWarnings("unused")
    private List<PlaceResult> searchFallback(String term, GeoPoint origin, int maxResults, Throwable t) {
        log.warn("Place search unavailable: term={}, cause={}", term, t.getMessage());
        throw new BusinessException(ErrorCode.PLACE_SEARCH_UNAVAILABLE,
                "Place search failed for '" + term + "'", t);
    }

    private PlaceResult toPlaceResult(LocalResult local) {
        Double latitude = local.gpsCoordinates() != null ? local.gpsCoordinates().latitude() : null;
        Double longitude = local.gpsCoordinates() != null ? local.gpsCoordinates().longitude() : null;
        String phone = local.links() != null ? local.links().phone() : null;
        return new PlaceResult(local.placeId(), local.title(), local.address(), latitude, longitude,
                local.rating(), local.reviews(), local.price(), local.type(), phone, null);
    }
}
