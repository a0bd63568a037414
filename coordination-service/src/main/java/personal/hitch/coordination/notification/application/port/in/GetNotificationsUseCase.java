package personal.hitch.coordination.notification.application.port.in;

import personal.hitch.coordination.notification.domain.model.Notification;

import java.util.List;

/**
 * 최근 알림 조회 Use Case
 */
public interface GetNotificationsUseCase {

    List<Notification> recent(Long userId, int limit);
}
