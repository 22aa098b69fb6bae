package io.github.drompincen.fixflow.gateway.controller;

import io.github.drompincen.fixflow.persistence.document.NotificationDocument;
import io.github.drompincen.fixflow.protocol.api.MessageResponse;
import io.github.drompincen.fixflow.protocol.api.NotificationDto;
import io.github.drompincen.fixflow.runtime.auth.CurrentUser;
import io.github.drompincen.fixflow.runtime.notification.NotificationService;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public List<NotificationDto> list(@AuthenticationPrincipal CurrentUser user) {
        return notificationService.listFor(user).stream().map(this::toDto).collect(Collectors.toList());
    }

    @PatchMapping("/{notificationId}/read")
    public MessageResponse markRead(@PathVariable String notificationId, @AuthenticationPrincipal CurrentUser user) {
        notificationService.markRead(notificationId, user);
        return new MessageResponse("Notification marked as read");
    }

    @PostMapping("/mark-all-read")
    public MessageResponse markAllRead(@AuthenticationPrincipal CurrentUser user) {
        notificationService.markAllRead(user);
        return new MessageResponse("All notifications marked as read");
    }

    private NotificationDto toDto(NotificationDocument n) {
        return new NotificationDto(n.getId(), n.getUserId(), n.getTitle(), n.getMessage(), n.getLink(),
                n.isRead(), n.getCreatedAt());
    }
}
