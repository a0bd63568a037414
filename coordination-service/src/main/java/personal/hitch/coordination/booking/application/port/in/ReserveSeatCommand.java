package personal.hitch.coordination.booking.application.port.in;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

/**
 * 좌석 예약 Command
 */
public record ReserveSeatCommand(
        Long rideId,
        Long passengerId,
        int seats) {

    public ReserveSeatCommand {
        if (rideId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Ride ID cannot be null");
        }
        if (passengerId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Passenger ID cannot be null");
        }
        if (seats <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seats must be a positive integer");
        }
    }
}
