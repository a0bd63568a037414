package personal.hitch.coordination.booking.application.port.out;

import personal.hitch.coordination.booking.domain.model.Booking;

/**
 * 예약 이벤트 발행 Port (Outbox)
 * 상태 변경과 같은 트랜잭션 안에서 호출된다.
 */
public interface BookingEventPort {

    void publishBookingEvent(Booking booking, Long driverId);
}
