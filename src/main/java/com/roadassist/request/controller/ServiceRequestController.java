package com.roadassist.request.controller;

import com.roadassist.common.dto.ApiResponse;
import com.roadassist.common.exception.BusinessException;
import com.roadassist.common.exception.ErrorCode;
import com.roadassist.common.security.Actor;
import com.roadassist.request.dto.CostEstimate;
import com.roadassist.request.dto.CreateServiceRequest;
import com.roadassist.request.dto.EstimateRequest;
import com.roadassist.request.dto.ServiceRequestResponse;
import com.roadassist.request.dto.StatusChange;
import com.roadassist.request.entity.ServiceRequest;
import com.roadassist.request.entity.ServiceStatus;
import com.roadassist.request.service.CostEstimator;
import com.roadassist.request.service.ServiceRequestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/services")
@RequiredArgsConstructor
public class ServiceRequestController {

    private final ServiceRequestService serviceRequestService;
    private final CostEstimator costEstimator;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<ServiceRequestResponse> create(@Valid @RequestBody CreateServiceRequest request, Actor actor) {
        return ApiResponse.ok(ServiceRequestResponse.from(serviceRequestService.create(request, actor)));
    }

    @GetMapping
    public ApiResponse<List<ServiceRequestResponse>> getWorkshopRequests(
            Actor actor,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "20") Integer limit,
            @RequestParam(defaultValue = "0") Integer offset) {
        ServiceStatus filter = parseStatusFilter(status);
        return ApiResponse.ok(toResponses(serviceRequestService.getWorkshopRequests(actor, filter, limit, offset)));
    }

    @GetMapping("/my-requests")
    public ApiResponse<List<ServiceRequestResponse>> getMyRequests(Actor actor) {
        return ApiResponse.ok(toResponses(serviceRequestService.getCustomerRequests(actor)));
    }

    @GetMapping("/my-tasks")
    public ApiResponse<List<ServiceRequestResponse>> getMyTasks(Actor actor) {
        return ApiResponse.ok(toResponses(serviceRequestService.getMechanicTasks(actor)));
    }

    @GetMapping("/{id}")
    public ApiResponse<ServiceRequestResponse> getRequest(@PathVariable Long id, Actor actor) {
        return ApiResponse.ok(ServiceRequestResponse.from(serviceRequestService.getRequest(id, actor)));
    }

    @PutMapping("/{id}/status")
    public ApiResponse<ServiceRequestResponse> changeStatus(@PathVariable Long id,
                                                            @Valid @RequestBody StatusChange change,
                                                            Actor actor) {
        return ApiResponse.ok(ServiceRequestResponse.from(serviceRequestService.transition(id, change, actor)));
    }

    @PostMapping("/estimate")
    public ApiResponse<CostEstimate> estimate(@Valid @RequestBody EstimateRequest request) {
        return ApiResponse.ok(costEstimator.estimate(request));
    }

    private static ServiceStatus parseStatusFilter(String status) {
        if (status == null || status.isBlank() || "ALL".equalsIgnoreCase(status)) {
            return null;
        }
        try {
            return ServiceStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Unknown status filter: " + status);
        }
    }

    private static List<ServiceRequestResponse> toResponses(List<ServiceRequest> requests) {
        return requests.stream().map(ServiceRequestResponse::from).toList();
    }
}
