package personal.hitch.coordination.booking.domain.model;

/**
 * 트랜잭션 결과
 * 커밋 이후 알림/브로드캐스트에 필요한 운행 정보와 실제 변경 여부를 함께 전달
 *
 * @param booking 최종 예약 상태
 * @param ride    예약이 속한 운행 (변경 후)
 * @param changed 이번 호출로 상태가 바뀌었는지 (멱등 호출이면 false)
 */
public record BookingOutcome(Booking booking, Ride ride, boolean changed) {

    public static BookingOutcome changed(Booking booking, Ride ride) {
        return new BookingOutcome(booking, ride, true);
    }

    public static BookingOutcome unchanged(Booking booking, Ride ride) {
        return new BookingOutcome(booking, ride, false);
    }
}
