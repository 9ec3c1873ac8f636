package com.roadassist.geo.controller;

import com.roadassist.common.dto.ApiResponse;
import com.roadassist.geo.model.GeoPoint;
import com.roadassist.geo.model.PlaceFilter;
import com.roadassist.geo.model.PlaceResult;
import com.roadassist.geo.model.SortKey;
import com.roadassist.geo.service.MechanicSearchService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;

/**
 * Discovery of mechanics listed with the external place provider.
 */
@RestController
@RequestMapping("/api/mechanics")
@RequiredArgsConstructor
public class MechanicSearchController {

    private final MechanicSearchService mechanicSearchService;

    /**
     * With {@code serviceTypes} (comma separated) every type is searched and the results merged;
     * otherwise a single {@code query} is searched and ranked by distance.
     */
    @GetMapping("/nearby")
    public ApiResponse<List<PlaceResult>> getNearby(@RequestParam(required = false) Double latitude,
                                                    @RequestParam(required = false) Double longitude,
                                                    @RequestParam(required = false) String query,
                                                    @RequestParam(required = false) String serviceTypes,
                                                    @RequestParam(required = false) Integer maxResults) {
        GeoPoint origin = GeoPoint.of(latitude, longitude);
        if (serviceTypes != null && !serviceTypes.isBlank()) {
            List<String> terms = Arrays.asList(serviceTypes.split(","));
            return ApiResponse.ok(mechanicSearchService.searchMany(origin, terms));
        }
        return ApiResponse.ok(mechanicSearchService.searchOne(origin, query, maxResults));
    }

    @GetMapping("/search")
    public ApiResponse<List<PlaceResult>> search(@RequestParam(required = false) Double latitude,
                                                 @RequestParam(required = false) Double longitude,
                                                 @RequestParam(required = false) String query,
                                                 @RequestParam(required = false) Double minRating,
                                                 @RequestParam(required = false) Double maxDistance,
                                                 @RequestParam(required = false) String priceRange,
                                                 @RequestParam(required = false) String sortBy) {
        GeoPoint origin = GeoPoint.of(latitude, longitude);
        PlaceFilter filter = new PlaceFilter(minRating, maxDistance, priceRange, SortKey.from(sortBy));
        return ApiResponse.ok(mechanicSearchService.searchFiltered(origin, query, filter));
    }
}
