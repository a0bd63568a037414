package personal.hitch.coordination.booking.application.port.in;

import personal.hitch.coordination.booking.domain.model.Ride;

/**
 * 운행 잔여 좌석 조회 Use Case
 */
public interface GetRemainingSeatsUseCase {

    Ride getRide(Long rideId);
}
