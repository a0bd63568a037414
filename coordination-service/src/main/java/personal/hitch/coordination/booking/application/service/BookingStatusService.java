package personal.hitch.coordination.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.hitch.coordination.booking.application.port.in.CancelBookingUseCase;
import personal.hitch.coordination.booking.application.port.in.ConfirmBookingUseCase;
import personal.hitch.coordination.booking.application.port.in.GetRemainingSeatsUseCase;
import personal.hitch.coordination.booking.domain.model.Booking;
import personal.hitch.coordination.booking.domain.model.BookingOutcome;
import personal.hitch.coordination.booking.domain.model.Ride;
import personal.hitch.coordination.booking.domain.service.BookingManager;

/**
 * Booking Status Service
 * 예약 확정/취소와 잔여 좌석 조회
 * 상태 변경은 조건부 UPDATE로 보호되므로 운행 락이 필요 없다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingStatusService implements ConfirmBookingUseCase, CancelBookingUseCase, GetRemainingSeatsUseCase {

    private final BookingManager bookingManager;
    private final BookingActivityPublisher bookingActivityPublisher;

    @Override
    public Booking confirm(Long bookingId, Long driverId) {
        BookingOutcome outcome = bookingManager.confirmInTransaction(bookingId, driverId);
        bookingActivityPublisher.bookingConfirmed(outcome.booking(), outcome.ride());
        return outcome.booking();
    }

    @Override
    public Booking cancel(Long bookingId, Long requesterId) {
        BookingOutcome outcome = bookingManager.cancelInTransaction(bookingId, requesterId);
        if (outcome.changed()) {
            bookingActivityPublisher.bookingCancelled(outcome.booking(), outcome.ride(), requesterId);
        }
        return outcome.booking();
    }

    @Override
    public Ride getRide(Long rideId) {
        return bookingManager.findRide(rideId);
    }
}
