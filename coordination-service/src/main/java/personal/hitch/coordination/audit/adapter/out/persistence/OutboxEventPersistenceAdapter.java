package personal.hitch.coordination.audit.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import personal.hitch.coordination.audit.application.port.out.OutboxEventRepository;
import personal.hitch.coordination.audit.domain.model.OutboxEvent;
import personal.hitch.coordination.audit.domain.model.OutboxEvent.OutboxEventStatus;

import java.util.List;

@Component
@RequiredArgsConstructor
public class OutboxEventPersistenceAdapter implements OutboxEventRepository {

    private final JpaOutboxEventRepository jpaOutboxEventRepository;

    @Override
    public OutboxEvent save(OutboxEvent outboxEvent) {
        return jpaOutboxEventRepository.save(OutboxEventEntity.fromDomain(outboxEvent)).toDomain();
    }

    @Override
    public List<OutboxEvent> findPending(int limit) {
        // FAILED는 상태로 걸러지므로 재시도 횟수 조건이 필요 없다
        return jpaOutboxEventRepository.findByStatusOrderByIdAsc(OutboxEventStatus.PENDING, PageRequest.of(0, limit))
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }
}
