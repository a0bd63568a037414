package personal.hitch.coordination.booking.domain.exception;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;
import personal.hitch.coordination.booking.domain.model.BookingStatus;

/**
 * Invalid Booking State Exception
 * 현재 상태에서 허용되지 않는 예약 상태 변경
 */
public class InvalidBookingStateException extends BusinessException {
    public InvalidBookingStateException(Long bookingId, BookingStatus current, BookingStatus target) {
        super(ErrorCode.INVALID_BOOKING_STATE,
                String.format("Cannot move booking from %s to %s: bookingId=%d", current, target, bookingId));
    }
}
