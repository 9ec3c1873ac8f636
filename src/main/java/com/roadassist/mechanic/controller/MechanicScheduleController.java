package com.roadassist.mechanic.controller;

import com.roadassist.common.dto.ApiResponse;
import com.roadassist.common.security.Actor;
import com.roadassist.mechanic.dto.AvailabilityChange;
import com.roadassist.mechanic.dto.ScheduleEntryRequest;
import com.roadassist.mechanic.entity.Availability;
import com.roadassist.mechanic.entity.Mechanic;
import com.roadassist.mechanic.entity.MechanicSchedule;
import com.roadassist.mechanic.service.MechanicScheduleService;
import com.roadassist.mechanic.service.MechanicService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/mechanic-schedules")
@RequiredArgsConstructor
public class MechanicScheduleController {

    private final MechanicScheduleService mechanicScheduleService;
    private final MechanicService mechanicService;

    @GetMapping("/mechanic/{mechanicId}")
    public ApiResponse<List<MechanicSchedule>> getSchedule(
            @PathVariable Long mechanicId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime endDate,
            Actor actor) {
        return ApiResponse.ok(mechanicScheduleService.getSchedule(mechanicId, startDate, endDate, actor));
    }

    @PostMapping
    public ApiResponse<MechanicSchedule> createEntry(@Valid @RequestBody ScheduleEntryRequest request, Actor actor) {
        return ApiResponse.ok(mechanicScheduleService.createEntry(request, actor));
    }

    @PutMapping("/{id}")
    public ApiResponse<MechanicSchedule> updateEntry(@PathVariable Long id,
                                                     @Valid @RequestBody ScheduleEntryRequest request,
                                                     Actor actor) {
        return ApiResponse.ok(mechanicScheduleService.updateEntry(id, request, actor));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Void> deleteEntry(@PathVariable Long id, Actor actor) {
        mechanicScheduleService.deleteEntry(id, actor);
        return ApiResponse.ok(null, "Schedule entry deleted successfully");
    }

    @GetMapping("/availability/{mechanicId}")
    public ApiResponse<Map<String, Availability>> getAvailability(@PathVariable Long mechanicId) {
        return ApiResponse.ok(Map.of("availability", mechanicService.getAvailability(mechanicId)));
    }

    @PatchMapping("/availability/{mechanicId}")
    public ApiResponse<Mechanic> changeAvailability(@PathVariable Long mechanicId,
                                                    @Valid @RequestBody AvailabilityChange change,
                                                    Actor actor) {
        return ApiResponse.ok(mechanicService.changeAvailability(mechanicId, change.availability(), actor));
    }
}
