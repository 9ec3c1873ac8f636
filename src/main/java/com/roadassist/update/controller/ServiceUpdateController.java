package com.roadassist.update.controller;

import com.roadassist.common.dto.ApiResponse;
import com.roadassist.common.security.Actor;
import com.roadassist.update.dto.AppendUpdateRequest;
import com.roadassist.update.entity.ServiceUpdate;
import com.roadassist.update.service.ServiceUpdateLog;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/services/{requestId}/updates")
@RequiredArgsConstructor
public class ServiceUpdateController {

    private final ServiceUpdateLog serviceUpdateLog;

    @GetMapping
    public ApiResponse<List<ServiceUpdate>> list(@PathVariable Long requestId, Actor actor) {
        return ApiResponse.ok(serviceUpdateLog.list(requestId, actor));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<ServiceUpdate> append(@PathVariable Long requestId,
                                             @Valid @RequestBody AppendUpdateRequest request,
                                             Actor actor) {
        return ApiResponse.ok(serviceUpdateLog.append(requestId, actor, request.message(), request.images()));
    }
}
