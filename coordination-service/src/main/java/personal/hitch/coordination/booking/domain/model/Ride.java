package personal.hitch.coordination.booking.domain.model;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;
import personal.hitch.coordination.booking.domain.exception.CapacityInvariantViolationException;
import personal.hitch.coordination.booking.domain.exception.RideNotBookableException;

import java.time.LocalDateTime;

/**
 * Ride Domain Model
 * 운행 도메인 모델 (불변)
 * 운행 정보 자체는 외부 CRUD 시스템이 관리하고, 이 서비스는 committedSeats만 변경한다.
 */
public record Ride(
        Long id,
        Long driverId,
        int totalSeats,
        int committedSeats,
        RideStatus status,
        LocalDateTime departureTime) {

    public Ride {
        if (driverId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Driver ID cannot be null");
        }
        if (totalSeats <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Total seats must be positive");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Ride status cannot be null");
        }
        if (departureTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Departure time cannot be null");
        }
    }

    public int remainingSeats() {
        return totalSeats - committedSeats;
    }

    public boolean isDriver(Long userId) {
        return driverId.equals(userId);
    }

    // ========== Domain Validation Methods (Tell, Don't Ask) ==========

    /**
     * 예약 가능 여부 검증 (좌석 수 제외)
     *
     * @throws RideNotBookableException 운전자 본인 예약, 예약 불가 상태, 이미 출발한 운행
     */
    public void ensureBookableBy(Long passengerId, LocalDateTime now) {
        if (isDriver(passengerId)) {
            throw new RideNotBookableException(id, "driver cannot book own ride");
        }
        if (!status.acceptsBookings()) {
            throw new RideNotBookableException(id, "ride is " + status);
        }
        if (!departureTime.isAfter(now)) {
            throw new RideNotBookableException(id, "ride has already departed");
        }
    }

    /**
     * 0 <= committedSeats <= totalSeats 검증
     * 위반은 복구 대상이 아니므로 즉시 실패한다.
     *
     * @throws CapacityInvariantViolationException 불변식 위반 시
     */
    public void ensureCapacityInvariant() {
        if (committedSeats < 0 || committedSeats > totalSeats) {
            throw new CapacityInvariantViolationException(id, committedSeats, totalSeats);
        }
    }
}
