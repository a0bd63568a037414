package personal.hitch.coordination.realtime.adapter.out.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.hitch.coordination.audit.adapter.out.persistence.JpaOutboxEventRepository;
import personal.hitch.coordination.audit.adapter.out.persistence.OutboxEventFactory;
import personal.hitch.coordination.realtime.application.port.out.RealtimeAuditPort;
import personal.hitch.coordination.room.domain.model.RoomId;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Realtime Audit Adapter
 * 위치/채팅 이벤트를 Outbox에 저장 (realtime.location, realtime.chat 토픽)
 * 감사 기록 실패는 이미 전파된 실시간 이벤트에 영향을 주지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RealtimeAuditAdapter implements RealtimeAuditPort {

    private final JpaOutboxEventRepository jpaOutboxEventRepository;
    private final OutboxEventFactory outboxEventFactory;
    private final Clock clock;

    @Override
    public void recordLocation(RoomId roomId, Long userId, Map<String, Object> location) {
        store(roomId, "LOCATION_UPDATED", new LocationAuditEvent(
                roomId.toString(), userId, location, Instant.now(clock).toString()));
    }

    @Override
    public void recordMessage(RoomId roomId, Long senderId, String text) {
        store(roomId, "MESSAGE_SENT", new MessageAuditEvent(
                roomId.toString(), senderId, text, Instant.now(clock).toString()));
    }

    private void store(RoomId roomId, String eventType, Object event) {
        try {
            jpaOutboxEventRepository.save(
                    outboxEventFactory.create(roomId.kind().name(), roomId.entityId(), eventType, event));
        } catch (RuntimeException e) {
            log.error("Failed to store realtime audit event: room={}, eventType={}", roomId, eventType, e);
        }
    }

    /**
     * Kafka 이벤트 DTO
     */
    public record LocationAuditEvent(String room, Long userId, Map<String, Object> location, String occurredAt) {
    }

    public record MessageAuditEvent(String room, Long senderId, String text, String occurredAt) {
    }
}
