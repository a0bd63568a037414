package personal.hitch.coordination.notification.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.hitch.common.exception.UpstreamUnavailableException;
import personal.hitch.coordination.notification.application.port.in.GetNotificationsUseCase;
import personal.hitch.coordination.notification.application.port.in.NotifyUserUseCase;
import personal.hitch.coordination.notification.application.port.out.NotificationRepository;
import personal.hitch.coordination.notification.application.port.out.PushNotificationPort;
import personal.hitch.coordination.notification.domain.model.Notification;
import personal.hitch.coordination.notification.domain.model.NotificationType;
import personal.hitch.coordination.notification.domain.model.PushResult;
import personal.hitch.coordination.presence.application.service.ConnectionRegistry;
import personal.hitch.coordination.presence.application.service.PresenceRegistry;
import personal.hitch.coordination.room.domain.model.RealtimeEvent;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Notification Dispatcher
 *
 * 처리 순서:
 * 1. 알림 저장 (전달 시도 전에 영속화)
 * 2. 온라인이면 실시간 연결로 notification 이벤트 전송
 * 3. 실시간 전송이 안 되면 외부 푸시 서비스로 전달
 *
 * 채널 실패는 로그만 남기고 재시도하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDispatcher implements NotifyUserUseCase, GetNotificationsUseCase {

    static final String NOTIFICATION_EVENT = "notification";
    private static final int MAX_LIMIT = 100;

    private final NotificationRepository notificationRepository;
    private final PushNotificationPort pushNotificationPort;
    private final PresenceRegistry presenceRegistry;
    private final ConnectionRegistry connectionRegistry;
    private final Clock clock;

    @Override
    public Notification notify(Long userId, NotificationType type, String title, String body,
                               Map<String, Object> data) {
        Notification saved = notificationRepository.save(
                Notification.create(userId, type, title, body, data, LocalDateTime.now(clock)));

        boolean delivered = deliverInBand(saved) || deliverByPush(saved);
        if (!delivered) {
            return saved;
        }

        notificationRepository.markDelivered(saved.id());
        return saved.markDelivered();
    }

    @Override
    public List<Notification> recent(Long userId, int limit) {
        return notificationRepository.findRecentByUserId(userId, Math.max(1, Math.min(limit, MAX_LIMIT)));
    }

    private boolean deliverInBand(Notification notification) {
        Optional<String> connectionId = presenceRegistry.resolve(notification.userId());
        if (connectionId.isEmpty()) {
            return false;
        }
        boolean sent = connectionRegistry.send(connectionId.get(),
                RealtimeEvent.of(NOTIFICATION_EVENT, notification.toPayload()));
        log.debug("In-band notification: notificationId={}, userId={}, sent={}",
                notification.id(), notification.userId(), sent);
        return sent;
    }

    private boolean deliverByPush(Notification notification) {
        try {
            PushResult result = pushNotificationPort.push(notification);
            if (result == PushResult.UNDELIVERABLE) {
                log.warn("Push undeliverable: notificationId={}, userId={}",
                        notification.id(), notification.userId());
                return false;
            }
            return true;
        } catch (UpstreamUnavailableException e) {
            log.error("Push service unavailable: notificationId={}, userId={}",
                    notification.id(), notification.userId(), e);
            return false;
        }
    }
}
