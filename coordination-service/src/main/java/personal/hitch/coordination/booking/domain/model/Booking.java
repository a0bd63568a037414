package personal.hitch.coordination.booking.domain.model;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;
import personal.hitch.coordination.booking.domain.exception.InvalidBookingStateException;

import java.time.LocalDateTime;

/**
 * Booking Domain Model
 * 좌석 예약 도메인 모델 (불변)
 */
public record Booking(
        Long id,
        Long rideId,
        Long passengerId,
        int seats,
        BookingStatus status,
        LocalDateTime createdAt,
        LocalDateTime updatedAt) {

    public Booking {
        if (rideId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Ride ID cannot be null");
        }
        if (passengerId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Passenger ID cannot be null");
        }
        if (seats <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seats must be positive");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking status cannot be null");
        }
        if (createdAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Creation time cannot be null");
        }
    }

    /**
     * 예약 생성 (정적 팩토리 메서드)
     *
     * @return 새로운 예약 (PENDING 상태)
     */
    public static Booking create(Long rideId, Long passengerId, int seats, LocalDateTime now) {
        return new Booking(null, rideId, passengerId, seats, BookingStatus.PENDING, now, now);
    }

    /**
     * 예약 확정 (PENDING -> CONFIRMED)
     */
    public Booking confirm(LocalDateTime now) {
        if (status != BookingStatus.PENDING) {
            throw new InvalidBookingStateException(id, status, BookingStatus.CONFIRMED);
        }
        return new Booking(id, rideId, passengerId, seats, BookingStatus.CONFIRMED, createdAt, now);
    }

    /**
     * 예약 취소 (PENDING | CONFIRMED -> CANCELLED)
     */
    public Booking cancel(LocalDateTime now) {
        if (!status.holdsSeats()) {
            throw new InvalidBookingStateException(id, status, BookingStatus.CANCELLED);
        }
        return new Booking(id, rideId, passengerId, seats, BookingStatus.CANCELLED, createdAt, now);
    }

    public boolean isActive() {
        return status.holdsSeats();
    }

    public boolean isCancelled() {
        return status == BookingStatus.CANCELLED;
    }

    public boolean isPassenger(Long userId) {
        return passengerId.equals(userId);
    }

    /**
     * 활성 예약 중복 방지 키 (rideId:passengerId)
     * 활성 상태가 아니면 null (DB Unique Index에서 제외)
     */
    public String activeBookingKey() {
        return isActive() ? rideId + ":" + passengerId : null;
    }
}
