package personal.hitch.coordination.notification.adapter.in.web.dto;

import personal.hitch.coordination.notification.domain.model.Notification;
import personal.hitch.coordination.notification.domain.model.NotificationType;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 알림 응답 DTO
 */
public record NotificationResponse(
        Long notificationId,
        NotificationType type,
        String title,
        String body,
        Map<String, Object> data,
        boolean delivered,
        LocalDateTime createdAt
) {
    public static NotificationResponse from(Notification notification) {
        return new NotificationResponse(
                notification.id(),
                notification.type(),
                notification.title(),
                notification.body(),
                notification.data(),
                notification.delivered(),
                notification.createdAt()
        );
    }
}
