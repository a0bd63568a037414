package personal.hitch.coordination.notification.application.port.in;

import personal.hitch.coordination.notification.domain.model.Notification;
import personal.hitch.coordination.notification.domain.model.NotificationType;

import java.util.Map;

/**
 * 사용자 알림 Use Case
 * 알림을 먼저 저장한 뒤, 온라인이면 실시간 연결로, 오프라인이면 푸시로 전달한다.
 */
public interface NotifyUserUseCase {

    Notification notify(Long userId, NotificationType type, String title, String body, Map<String, Object> data);
}
