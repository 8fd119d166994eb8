package com.RetailCore.pos_backend.controller;

import com.RetailCore.pos_backend.dto.response.ApiResponse;
import com.RetailCore.pos_backend.dto.response.NotificationResponse;
import com.RetailCore.pos_backend.service.NotificationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<NotificationResponse>>> getNotifications() {
        return ResponseEntity.ok(ApiResponse.success(notificationService.getNotifications()));
    }

    @PatchMapping("/{id}/read")
    public ResponseEntity<ApiResponse<NotificationResponse>> markAsRead(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(notificationService.markAsRead(id)));
    }

    @PatchMapping("/read-all")
    public ResponseEntity<ApiResponse<Integer>> markAllAsRead() {
        int updated = notificationService.markAllAsRead();
        return ResponseEntity.ok(ApiResponse.success(updated, updated + " notifications marked as read"));
    }

    @DeleteMapping
    public ResponseEntity<ApiResponse<Integer>> clearNotifications() {
        int removed = notificationService.clearNotifications();
        return ResponseEntity.ok(ApiResponse.success(removed, removed + " notifications cleared"));
    }
}
