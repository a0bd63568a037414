package personal.hitch.coordination.booking.adapter.in.web.dto;

import personal.hitch.coordination.booking.domain.model.Booking;
import personal.hitch.coordination.booking.domain.model.BookingStatus;

import java.time.LocalDateTime;

/**
 * 예약 응답 DTO
 */
public record BookingResponse(
        Long bookingId,
        Long rideId,
        Long passengerId,
        int seats,
        BookingStatus status,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.id(),
                booking.rideId(),
                booking.passengerId(),
                booking.seats(),
                booking.status(),
                booking.createdAt(),
                booking.updatedAt()
        );
    }
}
