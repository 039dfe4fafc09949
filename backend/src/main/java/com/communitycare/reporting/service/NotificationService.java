package com.communitycare.reporting.service;

import com.communitycare.reporting.auth.Actor;
import com.communitycare.reporting.dto.NotificationDTO;
import com.communitycare.reporting.model.Notification;
import com.communitycare.reporting.repository.NotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class NotificationService {
    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationRepository notificationRepository;

    public NotificationService(NotificationRepository notificationRepository) {
        this.notificationRepository = notificationRepository;
    }

    @Transactional
    public Notification notify(Long userId, Long reportId, String message) {
        return notify(userId, reportId, message, Notification.TYPE_STATUS_UPDATE);
    }

    /** Joins the caller's transaction: a failure here fails the triggering operation as a whole. */
    @Transactional
    public Notification notify(Long userId, Long reportId, String message, String type) {
        Notification saved = notificationRepository.save(new Notification(userId, reportId, message,
                type == null ? Notification.TYPE_STATUS_UPDATE : type));
        log.debug("[NOTIFY] user={} report={} type={}", userId, reportId, saved.getType());
        return saved;
    }

    public List<NotificationDTO> listForUser(Long userId) {
        return notificationRepository.findByUserIdOrderByCreatedAtDescIdDesc(userId).stream()
                .map(NotificationDTO::from)
                .collect(Collectors.toList());
    }

    /**
     * Viewing the list is what marks it read. The returned entries keep the read flags they had
     * before this call so the client can still highlight what was new.
     */
    @Transactional
    public List<NotificationDTO> viewNotifications(Actor actor) {
        List<NotificationDTO> items = listForUser(actor.id());
        markAllRead(actor.id());
        return items;
    }

    @Transactional
    public int markAllRead(Long userId) {
        int updated = notificationRepository.markAllReadForUser(userId);
        if (updated > 0) log.debug("[NOTIFY] user={} marked {} as read", userId, updated);
        return updated;
    }

    public long unreadCount(Long userId) {
        return notificationRepository.countByUserIdAndReadFalse(userId);
    }
}
