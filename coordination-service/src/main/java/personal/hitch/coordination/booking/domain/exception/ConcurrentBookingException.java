package personal.hitch.coordination.booking.domain.exception;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

/**
 * Concurrent Booking Exception
 * 운행 락 대기 시간을 초과했을 때 발생 (재시도 가능)
 */
public class ConcurrentBookingException extends BusinessException {
    public ConcurrentBookingException(Long rideId) {
        super(ErrorCode.CONCURRENT_BOOKING, String.format("Ride is busy, retry later: rideId=%d", rideId));
    }
}
