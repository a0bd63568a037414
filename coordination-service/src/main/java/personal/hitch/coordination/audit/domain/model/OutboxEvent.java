package personal.hitch.coordination.audit.domain.model;

import java.time.LocalDateTime;

/**
 * Outbox Event Domain Model
 * 상태 변경과 같은 트랜잭션에 저장되어 Kafka로 중계되는 감사 이벤트 (불변)
 *
 * @param lastError 마지막 발행 실패 사유 (없으면 null)
 */
public record OutboxEvent(
        Long id,
        String aggregateType,
        Long aggregateId,
        String eventType,
        String payload,
        OutboxEventStatus status,
        LocalDateTime createdAt,
        LocalDateTime publishedAt,
        int retryCount,
        String lastError) {

    private static final int MAX_ERROR_LENGTH = 500;

    /**
     * 같은 운행/배송/에스크로의 이벤트는 같은 파티션으로 보낸다 (예: BOOKING:42)
     */
    public String partitionKey() {
        return aggregateType + ":" + aggregateId;
    }

    public OutboxEvent markAsPublished(LocalDateTime now) {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                OutboxEventStatus.PUBLISHED, createdAt, now, retryCount, null);
    }

    /**
     * 발행 실패 기록
     * 재시도 한도에 도달하면 FAILED로 격리되어 더 이상 중계되지 않는다.
     */
    public OutboxEvent recordFailure(String reason, int maxRetries) {
        int attempts = retryCount + 1;
        OutboxEventStatus next = attempts >= maxRetries ? OutboxEventStatus.FAILED : status;
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                next, createdAt, publishedAt, attempts, truncate(reason));
    }

    public boolean isFailed() {
        return status == OutboxEventStatus.FAILED;
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= MAX_ERROR_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_ERROR_LENGTH);
    }

    public enum OutboxEventStatus {
        PENDING,
        PUBLISHED,
        FAILED      // 재시도 한도 초과, 수동 확인 필요
    }
}
