package personal.hitch.coordination.delivery.domain.model;

/**
 * 배송 상태
 */
public enum DeliveryStatus {
    OPEN,        // 배송원 모집 중
    ASSIGNED,    // 배송원 배정 (픽업 대기)
    IN_TRANSIT,  // 배송 중
    DELIVERED,   // 배송 완료
    DISPUTED,    // 분쟁
    CANCELLED    // 요청 취소
}
