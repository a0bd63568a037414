package personal.hitch.coordination.audit.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.hitch.coordination.audit.domain.model.OutboxEvent;
import personal.hitch.coordination.audit.domain.model.OutboxEvent.OutboxEventStatus;

import java.time.LocalDateTime;

/**
 * 감사 이벤트 Outbox 테이블
 * 기능별 Event Adapter가 상태 변경과 같은 트랜잭션에서 PENDING으로 저장한다.
 */
@Entity
@Table(name = "outbox_events",
        indexes = @Index(name = "idx_outbox_status_id", columnList = "status, id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // BOOKING, DELIVERY, ESCROW 또는 Room 종류(RIDE, PACKAGE, GROUP)
    @Column(name = "aggregate_type", nullable = false, length = 20)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false)
    private Long aggregateId;

    @Column(name = "event_type", nullable = false, length = 50)
    private String eventType;

    @Lob
    @Column(name = "payload", nullable = false)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OutboxEventStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "last_error", length = 500)
    private String lastError;

    static OutboxEventEntity pending(String aggregateType, Long aggregateId, String eventType, String payload) {
        OutboxEventEntity entity = new OutboxEventEntity();
        entity.aggregateType = aggregateType;
        entity.aggregateId = aggregateId;
        entity.eventType = eventType;
        entity.payload = payload;
        entity.status = OutboxEventStatus.PENDING;
        return entity;
    }

    static OutboxEventEntity fromDomain(OutboxEvent event) {
        OutboxEventEntity entity = pending(event.aggregateType(), event.aggregateId(), event.eventType(), event.payload());
        entity.id = event.id();
        entity.status = event.status();
        entity.createdAt = event.createdAt();
        entity.publishedAt = event.publishedAt();
        entity.retryCount = event.retryCount();
        entity.lastError = event.lastError();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    OutboxEvent toDomain() {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                status, createdAt, publishedAt, retryCount, lastError);
    }
}
