package personal.hitch.coordination.booking.domain.exception;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

/**
 * Booking Access Denied Exception
 * 승객/운전자가 아닌 사용자가 예약을 변경하려 할 때 발생
 */
public class BookingAccessDeniedException extends BusinessException {
    public BookingAccessDeniedException(Long bookingId, Long userId) {
        super(ErrorCode.FORBIDDEN, String.format("User cannot modify booking: bookingId=%d, userId=%d", bookingId, userId));
    }
}
