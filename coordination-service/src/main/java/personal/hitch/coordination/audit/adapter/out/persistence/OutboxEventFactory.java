package personal.hitch.coordination.audit.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

/**
 * Outbox Event Factory (Adapter Layer)
 * 이벤트 DTO를 직렬화하여 OutboxEventEntity로 변환하는 팩토리
 * 각 기능의 Event Adapter가 자신의 DTO를 만들어 전달한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxEventFactory {

    private final ObjectMapper objectMapper;

    public OutboxEventEntity create(String aggregateType, Long aggregateId, String eventType, Object event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            return OutboxEventEntity.pending(aggregateType, aggregateId, eventType, payload);
        } catch (JsonProcessingException e) {
            log.error("Failed to create outbox event: aggregateType={}, aggregateId={}, eventType={}",
                    aggregateType, aggregateId, eventType, e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to create outbox event", e);
        }
    }
}
