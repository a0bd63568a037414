package personal.hitch.coordination.audit.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.hitch.coordination.audit.application.config.OutboxPublisherProperties;
import personal.hitch.coordination.audit.application.port.in.PublishPendingEventsUseCase;
import personal.hitch.coordination.audit.application.port.out.AuditEventPublisher;
import personal.hitch.coordination.audit.application.port.out.OutboxEventRepository;
import personal.hitch.coordination.audit.domain.model.OutboxEvent;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Outbox Event Service
 * PENDING 감사 이벤트를 Kafka로 중계한다.
 * 한 이벤트의 발행 실패는 재시도 횟수만 올리고 나머지 이벤트의 중계를 막지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxEventService implements PublishPendingEventsUseCase {

    private final OutboxEventRepository outboxEventRepository;
    private final AuditEventPublisher eventPublisher;
    private final OutboxPublisherProperties properties;
    private final Clock clock;

    @Override
    @Transactional
    public int publishPendingEvents() {
        List<OutboxEvent> pendingEvents = outboxEventRepository.findPending(properties.getBatchSize());
        int publishedCount = 0;

        for (OutboxEvent event : pendingEvents) {
            try {
                String topic = mapToTopic(event.aggregateType(), event.eventType());
                eventPublisher.publishRaw(topic, event.partitionKey(), event.payload());
                outboxEventRepository.save(event.markAsPublished(LocalDateTime.now(clock)));
                publishedCount++;
            } catch (RuntimeException e) {
                OutboxEvent failed = event.recordFailure(e.getMessage(), properties.getMaxRetries());
                outboxEventRepository.save(failed);
                if (failed.isFailed()) {
                    log.error("Audit event quarantined after {} attempts: id={}, type={}",
                            failed.retryCount(), event.id(), event.eventType(), e);
                } else {
                    log.warn("Audit event publish failed: id={}, type={}, attempt={}, reason={}",
                            event.id(), event.eventType(), failed.retryCount(), e.getMessage());
                }
            }
        }
        return publishedCount;
    }

    /**
     * 거래성 이벤트는 Aggregate별 토픽, 실시간 이벤트는 위치/채팅 토픽으로 보낸다.
     */
    String mapToTopic(String aggregateType, String eventType) {
        return switch (aggregateType) {
            case "BOOKING" -> "booking.events";
            case "DELIVERY" -> "delivery.events";
            case "ESCROW" -> "escrow.events";
            case "RIDE", "PACKAGE", "GROUP", "CALL" -> switch (eventType) {
                case "LOCATION_UPDATED" -> "realtime.location";
                case "MESSAGE_SENT" -> "realtime.chat";
                default -> throw new IllegalArgumentException("Unknown realtime event type: " + eventType);
            };
            default -> throw new IllegalArgumentException("Unknown aggregate type: " + aggregateType);
        };
    }
}
