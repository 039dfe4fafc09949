package com.communitycare.reporting.controller;

import com.communitycare.reporting.auth.Actor;
import com.communitycare.reporting.auth.ActorResolver;
import com.communitycare.reporting.dto.NotificationDTO;
import com.communitycare.reporting.service.NotificationService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/notifications")
@CrossOrigin(origins = "*")
public class NotificationController {

    private final NotificationService notificationService;
    private final ActorResolver actorResolver;

    public NotificationController(NotificationService notificationService, ActorResolver actorResolver) {
        this.notificationService = notificationService;
        this.actorResolver = actorResolver;
    }

    /** Lists the caller's notifications and marks them read. */
    @GetMapping
    public List<NotificationDTO> view(@RequestHeader(value = ActorResolver.ACTOR_HEADER, required = false) Long userId) {
        return notificationService.viewNotifications(actorResolver.resolve(userId));
    }

    @GetMapping("/unread-count")
    public Map<String, Object> unreadCount(@RequestHeader(value = ActorResolver.ACTOR_HEADER, required = false) Long userId) {
        Actor actor = actorResolver.resolve(userId);
        return Map.of("unread", notificationService.unreadCount(actor.id()));
    }

    @PostMapping("/read-all")
    public Map<String, Object> markAllRead(@RequestHeader(value = ActorResolver.ACTOR_HEADER, required = false) Long userId) {
        Actor actor = actorResolver.resolve(userId);
        return Map.of("updated", notificationService.markAllRead(actor.id()));
    }
}
