package com.postboard.backend.controllers.api;

import com.postboard.backend.services.NotificationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Public notification endpoints. Each operation answers on both the
 * {@code notifications} and the {@code notifications_21201532} address.
 */
@RestController
@RequestMapping("/api/public")
@RequiredArgsConstructor
public class NotificationApiController {

    private final NotificationService notificationService;

    @GetMapping({"/notifications/{username}", "/notifications_21201532/{username}"})
    public ResponseEntity<Map<String, Object>> getNotifications(@PathVariable String username) {
        return ResponseEntity.ok(Map.of("notifications", notificationService.getForUsername(username)));
    }

    @PostMapping({"/notifications/{username}/mark-read", "/notifications_21201532/{username}/mark-read"})
    public ResponseEntity<Map<String, Object>> markAllRead(@PathVariable String username) {
        int updated = notificationService.markAllRead(username);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Notifications marked as read");
        body.put("updated", updated);
        return ResponseEntity.ok(body);
    }
}
