package personal.hitch.coordination.booking.domain.exception;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

/**
 * Ride Not Found Exception
 * 운행을 찾을 수 없을 때 발생하는 예외
 */
public class RideNotFoundException extends BusinessException {
    public RideNotFoundException(Long rideId) {
        super(ErrorCode.RIDE_NOT_FOUND, String.format("Ride not found: rideId=%d", rideId));
    }
}
