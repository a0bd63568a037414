package personal.hitch.coordination.notification.application.port.out;

import personal.hitch.coordination.notification.domain.model.Notification;
import personal.hitch.coordination.notification.domain.model.PushResult;

/**
 * 외부 푸시 서비스 Port
 * 재시도 정책은 푸시 서비스가 담당한다.
 */
public interface PushNotificationPort {

    /**
     * @throws personal.hitch.common.exception.UpstreamUnavailableException 푸시 서비스 장애
     */
    PushResult push(Notification notification);
}
