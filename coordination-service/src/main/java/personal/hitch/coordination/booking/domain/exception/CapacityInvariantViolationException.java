package personal.hitch.coordination.booking.domain.exception;

/**
 * Capacity Invariant Violation
 * committedSeats가 [0, totalSeats] 범위를 벗어난 경우
 * 비즈니스 에러가 아니라 내부 결함이므로 ErrorCode로 매핑하지 않는다.
 */
public class CapacityInvariantViolationException extends IllegalStateException {
    public CapacityInvariantViolationException(Long rideId, int committedSeats, int totalSeats) {
        super(String.format("Seat capacity invariant violated: rideId=%d, committed=%d, total=%d",
                rideId, committedSeats, totalSeats));
    }

    public CapacityInvariantViolationException(String message) {
        super(message);
    }
}
