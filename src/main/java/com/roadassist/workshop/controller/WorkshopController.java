package com.roadassist.workshop.controller;

import com.roadassist.common.dto.ApiResponse;
import com.roadassist.common.security.Actor;
import com.roadassist.geo.model.GeoPoint;
import com.roadassist.geo.model.NearbyWorkshop;
import com.roadassist.geo.model.SortKey;
import com.roadassist.mechanic.entity.Mechanic;
import com.roadassist.mechanic.service.MechanicService;
import com.roadassist.workshop.service.WorkshopService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/workshops")
@RequiredArgsConstructor
public class WorkshopController {

    private final WorkshopService workshopService;
    private final MechanicService mechanicService;

    @GetMapping("/nearby")
    public ApiResponse<List<NearbyWorkshop>> getNearby(@RequestParam(required = false) Double latitude,
                                                       @RequestParam(required = false) Double longitude,
                                                       @RequestParam(required = false) Double radius,
                                                       @RequestParam(required = false) String sortBy) {
        GeoPoint origin = GeoPoint.ofNullable(latitude, longitude);
        return ApiResponse.ok(workshopService.findNearby(origin, SortKey.from(sortBy), radius));
    }

    @GetMapping("/mechanics")
    public ApiResponse<List<Mechanic>> getWorkshopMechanics(Actor actor) {
        return ApiResponse.ok(mechanicService.getWorkshopMechanics(actor));
    }
}
