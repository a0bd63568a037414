package personal.hitch.coordination.booking.adapter.in.web.dto;

import personal.hitch.coordination.booking.domain.model.Ride;
import personal.hitch.coordination.booking.domain.model.RideStatus;

/**
 * 잔여 좌석 응답 DTO
 */
public record RideSeatsResponse(
        Long rideId,
        int totalSeats,
        int committedSeats,
        int remainingSeats,
        RideStatus status
) {
    public static RideSeatsResponse from(Ride ride) {
        return new RideSeatsResponse(
                ride.id(),
                ride.totalSeats(),
                ride.committedSeats(),
                ride.remainingSeats(),
                ride.status()
        );
    }
}
