package personal.hitch.coordination.realtime.application.port.out;

import personal.hitch.coordination.room.domain.model.RoomId;

import java.util.Map;

/**
 * 실시간 이벤트 감사 기록 Port
 * 위치와 채팅은 외부 시스템이 영속화하므로 이벤트만 남긴다.
 */
public interface RealtimeAuditPort {

    void recordLocation(RoomId roomId, Long userId, Map<String, Object> location);

    void recordMessage(RoomId roomId, Long senderId, String text);
}
