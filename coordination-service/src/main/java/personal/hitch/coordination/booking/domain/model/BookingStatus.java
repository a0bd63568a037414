package personal.hitch.coordination.booking.domain.model;

/**
 * 예약 상태
 */
public enum BookingStatus {
    PENDING,    // 운전자 확정 대기
    CONFIRMED,  // 운전자 확정
    CANCELLED,  // 취소 (좌석 반환)
    COMPLETED;  // 운행 완료

    /**
     * 좌석을 점유하는 상태인지 여부
     */
    public boolean holdsSeats() {
        return this == PENDING || this == CONFIRMED;
    }
}
