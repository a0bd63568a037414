package personal.hitch.coordination.notification.domain.model;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Notification Domain Model
 * 사용자 알림 (불변)
 *
 * @param delivered 실시간 연결 또는 푸시로 전달되었는지 여부
 */
public record Notification(
        Long id,
        Long userId,
        NotificationType type,
        String title,
        String body,
        Map<String, Object> data,
        boolean delivered,
        LocalDateTime createdAt) {

    public Notification {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (type == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Notification type cannot be null");
        }
        if (title == null || title.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Notification title cannot be blank");
        }
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static Notification create(Long userId, NotificationType type, String title, String body,
                                      Map<String, Object> data, LocalDateTime now) {
        return new Notification(null, userId, type, title, body, data, false, now);
    }

    public Notification markDelivered() {
        return new Notification(id, userId, type, title, body, data, true, createdAt);
    }

    /**
     * 실시간 이벤트 payload (type 포함)
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("notificationId", id);
        payload.put("type", type.name());
        payload.put("title", title);
        payload.put("body", body);
        payload.put("data", data);
        payload.put("createdAt", createdAt.toString());
        return payload;
    }
}
