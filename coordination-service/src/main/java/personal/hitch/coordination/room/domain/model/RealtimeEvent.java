package personal.hitch.coordination.room.domain.model;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Realtime Event
 * 연결로 전송되는 이벤트 (불변)
 *
 * @param type       이벤트 이름 (예: location_updated)
 * @param payload    이벤트 본문
 * @param occurredAt 발생 시각
 */
public record RealtimeEvent(
        String type,
        Map<String, Object> payload,
        Instant occurredAt) {

    public RealtimeEvent {
        if (type == null || type.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Event type cannot be blank");
        }
        // null 값을 허용해야 하므로 Map.copyOf 대신 LinkedHashMap 복사
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        if (occurredAt == null) {
            occurredAt = Instant.now();
        }
    }

    public static RealtimeEvent of(String type, Map<String, Object> payload) {
        return new RealtimeEvent(type, payload, Instant.now());
    }

    public static RealtimeEvent of(String type) {
        return new RealtimeEvent(type, Map.of(), Instant.now());
    }
}
