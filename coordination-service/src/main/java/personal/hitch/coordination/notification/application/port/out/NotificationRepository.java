package personal.hitch.coordination.notification.application.port.out;

import personal.hitch.coordination.notification.domain.model.Notification;

import java.util.List;

/**
 * Notification Repository Port
 */
public interface NotificationRepository {

    Notification save(Notification notification);

    /**
     * 전달 완료 표시 (아직 전달되지 않은 경우에만)
     */
    boolean markDelivered(Long notificationId);

    List<Notification> findRecentByUserId(Long userId, int limit);
}
