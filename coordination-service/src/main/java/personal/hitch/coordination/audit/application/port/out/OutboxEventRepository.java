package personal.hitch.coordination.audit.application.port.out;

import personal.hitch.coordination.audit.domain.model.OutboxEvent;

import java.util.List;

/**
 * Outbox 저장소 Port
 */
public interface OutboxEventRepository {

    OutboxEvent save(OutboxEvent outboxEvent);

    /**
     * 발행 대기 이벤트를 저장 순서대로 최대 limit건 조회
     */
    List<OutboxEvent> findPending(int limit);
}
