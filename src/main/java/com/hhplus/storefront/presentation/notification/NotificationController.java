package com.hhplus.storefront.presentation.notification;

import com.hhplus.storefront.application.notification.NotificationService;
import com.hhplus.storefront.application.notification.dto.UserMessageResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/notifications")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public ResponseEntity<List<UserMessageResponse>> getMessages(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(notificationService.getMessages(userId));
    }

    @PostMapping("/{message_id}/read")
    public ResponseEntity<UserMessageResponse> markAsRead(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("message_id") Long messageId) {
        return ResponseEntity.ok(notificationService.markAsRead(userId, messageId));
    }
}
