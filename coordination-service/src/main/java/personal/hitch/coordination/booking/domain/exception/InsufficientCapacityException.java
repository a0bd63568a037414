package personal.hitch.coordination.booking.domain.exception;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

/**
 * Insufficient Capacity Exception
 * 요청 좌석 수가 남은 좌석 수보다 많을 때 발생
 * HTTP 409 Conflict 반환용
 */
public class InsufficientCapacityException extends BusinessException {
    private final int remainingSeats;

    public InsufficientCapacityException(Long rideId, int requestedSeats, int remainingSeats) {
        super(ErrorCode.INSUFFICIENT_CAPACITY,
                String.format("Not enough seats: rideId=%d, requested=%d, remaining=%d",
                        rideId, requestedSeats, remainingSeats));
        this.remainingSeats = remainingSeats;
    }

    public int getRemainingSeats() {
        return remainingSeats;
    }
}
