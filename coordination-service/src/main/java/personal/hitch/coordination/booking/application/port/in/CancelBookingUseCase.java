package personal.hitch.coordination.booking.application.port.in;

import personal.hitch.coordination.booking.domain.model.Booking;

/**
 * 예약 취소 Use Case
 * 승객 또는 운전자가 취소할 수 있으며, 이미 취소된 예약에 대한 재호출은 변경 없이 성공한다.
 */
public interface CancelBookingUseCase {

    Booking cancel(Long bookingId, Long requesterId);
}
