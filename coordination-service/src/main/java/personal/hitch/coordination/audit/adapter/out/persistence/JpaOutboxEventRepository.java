package personal.hitch.coordination.audit.adapter.out.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import personal.hitch.coordination.audit.domain.model.OutboxEvent.OutboxEventStatus;

import java.util.List;

public interface JpaOutboxEventRepository extends JpaRepository<OutboxEventEntity, Long> {

    List<OutboxEventEntity> findByStatusOrderByIdAsc(OutboxEventStatus status, Pageable pageable);

    List<OutboxEventEntity> findByAggregateTypeAndEventTypeOrderByIdAsc(String aggregateType, String eventType);
}
