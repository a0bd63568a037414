package personal.hitch.coordination.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.hitch.coordination.booking.adapter.in.web.dto.BookingResponse;
import personal.hitch.coordination.booking.adapter.in.web.dto.ReserveSeatRequest;
import personal.hitch.coordination.booking.adapter.in.web.dto.RideSeatsResponse;
import personal.hitch.coordination.booking.application.port.in.CancelBookingUseCase;
import personal.hitch.coordination.booking.application.port.in.ConfirmBookingUseCase;
import personal.hitch.coordination.booking.application.port.in.GetRemainingSeatsUseCase;
import personal.hitch.coordination.booking.application.port.in.ReserveSeatUseCase;
import personal.hitch.coordination.booking.domain.model.Booking;

/**
 * Booking API Controller
 * 좌석 예약, 확정, 취소 및 잔여 좌석 조회 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class BookingController {

    private final ReserveSeatUseCase reserveSeatUseCase;
    private final ConfirmBookingUseCase confirmBookingUseCase;
    private final CancelBookingUseCase cancelBookingUseCase;
    private final GetRemainingSeatsUseCase getRemainingSeatsUseCase;

    /**
     * 좌석 예약
     * POST /api/v1/rides/{rideId}/bookings
     */
    @PostMapping("/rides/{rideId}/bookings")
    public ResponseEntity<BookingResponse> reserveSeat(
            @PathVariable Long rideId,
            @Valid @RequestBody ReserveSeatRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Reserve seat: rideId={}, userId={}, seats={}", rideId, userId, request.seats());

        Booking booking = reserveSeatUseCase.reserveSeat(request.toCommand(rideId, userId));

        return ResponseEntity.status(HttpStatus.CREATED).body(BookingResponse.from(booking));
    }

    /**
     * 예약 확정 (운전자)
     * POST /api/v1/bookings/{bookingId}/confirm
     */
    @PostMapping("/bookings/{bookingId}/confirm")
    public ResponseEntity<BookingResponse> confirm(
            @PathVariable Long bookingId,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Confirm booking: bookingId={}, userId={}", bookingId, userId);
        return ResponseEntity.ok(BookingResponse.from(confirmBookingUseCase.confirm(bookingId, userId)));
    }

    /**
     * 예약 취소 (승객 또는 운전자)
     * POST /api/v1/bookings/{bookingId}/cancel
     */
    @PostMapping("/bookings/{bookingId}/cancel")
    public ResponseEntity<BookingResponse> cancel(
            @PathVariable Long bookingId,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Cancel booking: bookingId={}, userId={}", bookingId, userId);
        return ResponseEntity.ok(BookingResponse.from(cancelBookingUseCase.cancel(bookingId, userId)));
    }

    /**
     * 잔여 좌석 조회
     * GET /api/v1/rides/{rideId}/seats
     */
    @GetMapping("/rides/{rideId}/seats")
    public ResponseEntity<RideSeatsResponse> getSeats(@PathVariable Long rideId) {
        return ResponseEntity.ok(RideSeatsResponse.from(getRemainingSeatsUseCase.getRide(rideId)));
    }
}
