package personal.hitch.coordination.escrow.adapter.out.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.hitch.coordination.audit.adapter.out.persistence.JpaOutboxEventRepository;
import personal.hitch.coordination.audit.adapter.out.persistence.OutboxEventFactory;
import personal.hitch.coordination.escrow.application.port.out.EscrowEventPort;
import personal.hitch.coordination.escrow.domain.model.Escrow;

/**
 * Escrow Event Adapter
 * 결제 대행사는 escrow.events 토픽의 RELEASED/REFUNDED 이벤트로 정산한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EscrowEventAdapter implements EscrowEventPort {

    private static final String AGGREGATE_TYPE = "ESCROW";

    private final JpaOutboxEventRepository jpaOutboxEventRepository;
    private final OutboxEventFactory outboxEventFactory;

    @Override
    public void publishEscrowEvent(Escrow escrow, String eventType) {
        EscrowAuditEvent event = new EscrowAuditEvent(
                escrow.id(),
                escrow.payerId(),
                escrow.amount().toPlainString(),
                escrow.currency(),
                escrow.status().name(),
                escrow.subjectType().name(),
                escrow.subjectId(),
                escrow.processorReference(),
                escrow.disputeReason(),
                String.valueOf(escrow.updatedAt()));

        jpaOutboxEventRepository.save(outboxEventFactory.create(AGGREGATE_TYPE, escrow.id(), eventType, event));
        log.debug("Escrow event stored: escrowId={}, eventType={}", escrow.id(), eventType);
    }

    /**
     * Kafka 이벤트 DTO
     */
    public record EscrowAuditEvent(
            Long escrowId,
            Long payerId,
            String amount,
            String currency,
            String status,
            String subjectType,
            Long subjectId,
            String processorReference,
            String disputeReason,
            String occurredAt) {
    }
}
