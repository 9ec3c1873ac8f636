package com.roadassist.notification.controller;

import com.roadassist.common.dto.ApiResponse;
import com.roadassist.common.security.Actor;
import com.roadassist.notification.entity.Notification;
import com.roadassist.notification.service.NotificationService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;

    @GetMapping
    public ApiResponse<List<Notification>> getNotifications(Actor actor,
                                                            @RequestParam(defaultValue = "false") boolean unreadOnly,
                                                            @RequestParam(required = false) Integer limit) {
        return ApiResponse.ok(notificationService.getNotifications(actor, unreadOnly, limit));
    }

    @GetMapping("/unread-count")
    public ApiResponse<Map<String, Long>> getUnreadCount(Actor actor) {
        return ApiResponse.ok(Map.of("count", notificationService.getUnreadCount(actor)));
    }

    @PatchMapping("/{id}/read")
    public ApiResponse<Notification> markRead(@PathVariable Long id, Actor actor) {
        return ApiResponse.ok(notificationService.markRead(id, actor), "Notification marked as read");
    }

    @PatchMapping("/read-all")
    public ApiResponse<Map<String, Integer>> markAllRead(Actor actor) {
        return ApiResponse.ok(Map.of("updated", notificationService.markAllRead(actor)),
                "All notifications marked as read");
    }
}
