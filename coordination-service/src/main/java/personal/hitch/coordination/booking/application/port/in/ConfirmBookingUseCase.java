package personal.hitch.coordination.booking.application.port.in;

import personal.hitch.coordination.booking.domain.model.Booking;

/**
 * 예약 확정 Use Case (운전자 전용, PENDING -> CONFIRMED)
 */
public interface ConfirmBookingUseCase {

    Booking confirm(Long bookingId, Long driverId);
}
