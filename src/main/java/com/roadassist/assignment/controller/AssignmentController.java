package com.roadassist.assignment.controller;

import com.roadassist.assignment.service.AssignmentCoordinator;
import com.roadassist.common.dto.ApiResponse;
import com.roadassist.common.security.Actor;
import com.roadassist.request.dto.AssignMechanicRequest;
import com.roadassist.request.dto.ServiceRequestResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/services")
@RequiredArgsConstructor
public class AssignmentController {

    private final AssignmentCoordinator assignmentCoordinator;

    @PutMapping("/{id}/assign")
    public ApiResponse<ServiceRequestResponse> assign(@PathVariable Long id,
                                                      @Valid @RequestBody AssignMechanicRequest request,
                                                      Actor actor) {
        return ApiResponse.ok(ServiceRequestResponse.from(
                assignmentCoordinator.assign(id, request.mechanicId(), actor)), "Mechanic assigned");
    }
}
