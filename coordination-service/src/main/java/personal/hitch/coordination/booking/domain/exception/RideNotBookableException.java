package personal.hitch.coordination.booking.domain.exception;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

/**
 * Ride Not Bookable Exception
 * 운전자 본인 예약, 예약 불가 상태, 이미 출발한 운행
 */
public class RideNotBookableException extends BusinessException {
    public RideNotBookableException(Long rideId, String reason) {
        super(ErrorCode.RIDE_NOT_BOOKABLE, String.format("Ride is not bookable: rideId=%d, reason=%s", rideId, reason));
    }
}
