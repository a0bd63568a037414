package personal.hitch.coordination.booking.domain.model;

/**
 * 운행 상태
 */
public enum RideStatus {
    OPEN,        // 예약 가능
    FULL,        // 좌석 소진 (취소 시 OPEN 복귀)
    IN_PROGRESS, // 운행 중
    COMPLETED,   // 운행 완료
    CANCELLED;   // 운행 취소

    public boolean acceptsBookings() {
        return this == OPEN || this == FULL;
    }
}
