package com.roadassist.geo.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

/**
 * Local business search of the third-party place provider ({@code engine=google_local}).
 */
@FeignClient(name = "place-search", url = "${roadassist.place-search.url:https://serpapi.com}")
public interface SerpApiClient {

    @GetMapping("/search")
    LocalSearchResponse search(@RequestParam("engine") String engine,
                               @RequestParam("q") String query,
                               @RequestParam("location") String location,
                               @RequestParam("api_key") String apiKey,
                               @RequestParam("num") int num);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LocalSearchResponse(@JsonProperty("local_results") List<LocalResult> localResults) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LocalResult(String title,
                       Double rating,
                       Integer reviews,
                       String price,
                       String type,
                       String address,
                       @JsonProperty("place_id") String placeId,
                       @JsonProperty("gps_coordinates") GpsCoordinates gpsCoordinates,
                       Links links) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GpsCoordinates(Double latitude, Double longitude) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Links(String phone, String website) {}
}
