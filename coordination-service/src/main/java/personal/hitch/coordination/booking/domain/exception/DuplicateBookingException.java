package personal.hitch.coordination.booking.domain.exception;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

/**
 * Duplicate Booking Exception
 * 같은 승객이 같은 운행에 활성 예약을 이미 가지고 있을 때 발생
 * HTTP 409 Conflict 반환용
 */
public class DuplicateBookingException extends BusinessException {
    public DuplicateBookingException(Long rideId, Long passengerId) {
        super(ErrorCode.DUPLICATE_BOOKING,
                String.format("Passenger already holds an active booking: rideId=%d, passengerId=%d", rideId, passengerId));
    }
}
