package personal.hitch.coordination.delivery.adapter.out.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.hitch.coordination.audit.adapter.out.persistence.JpaOutboxEventRepository;
import personal.hitch.coordination.audit.adapter.out.persistence.OutboxEventFactory;
import personal.hitch.coordination.delivery.application.port.out.DeliveryEventPort;
import personal.hitch.coordination.delivery.domain.model.Delivery;

import java.time.LocalDateTime;

/**
 * Delivery Event Adapter
 * 배송 배정 감사 이벤트를 Outbox에 저장
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeliveryEventAdapter implements DeliveryEventPort {

    private static final String AGGREGATE_TYPE = "DELIVERY";

    private final JpaOutboxEventRepository jpaOutboxEventRepository;
    private final OutboxEventFactory outboxEventFactory;

    @Override
    public void publishAccepted(Delivery delivery) {
        store("DELIVERY_ACCEPTED", new DeliveryAuditEvent(
                delivery.id(), delivery.senderId(), delivery.assignedCourierId(),
                delivery.status().name(), String.valueOf(delivery.acceptedAt())));
    }

    @Override
    public void publishAssignmentCancelled(Delivery delivery, Long courierId) {
        store("DELIVERY_ASSIGNMENT_CANCELLED", new DeliveryAuditEvent(
                delivery.id(), delivery.senderId(), courierId,
                delivery.status().name(), LocalDateTime.now().toString()));
    }

    private void store(String eventType, DeliveryAuditEvent event) {
        jpaOutboxEventRepository.save(
                outboxEventFactory.create(AGGREGATE_TYPE, event.deliveryId(), eventType, event));
        log.debug("Delivery event stored: deliveryId={}, eventType={}", event.deliveryId(), eventType);
    }

    /**
     * Kafka 이벤트 DTO
     */
    public record DeliveryAuditEvent(
            Long deliveryId,
            Long senderId,
            Long courierId,
            String status,
            String occurredAt) {
    }
}
