package personal.hitch.coordination.booking.application.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import personal.hitch.common.exception.BusinessException;
import personal.hitch.coordination.booking.application.port.in.ReserveSeatCommand;
import personal.hitch.coordination.booking.application.port.in.ReserveSeatUseCase;
import personal.hitch.coordination.booking.application.port.out.RideLockPort;
import personal.hitch.coordination.booking.domain.exception.ConcurrentBookingException;
import personal.hitch.coordination.booking.domain.exception.DuplicateBookingException;
import personal.hitch.coordination.booking.domain.model.Booking;
import personal.hitch.coordination.booking.domain.model.BookingOutcome;
import personal.hitch.coordination.booking.domain.service.BookingManager;

import java.util.UUID;

/**
 * Seat Reservation Service (SRP)
 * 단일 책임: 좌석 예약 처리
 *
 * 운행 락 -> 트랜잭션(중복 확인, 조건부 좌석 확보, 예약 저장) -> 락 해제 -> 브로드캐스트/알림
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeatReservationService implements ReserveSeatUseCase {

    private static final String RESERVATION_METRIC = "capacity.reservations";

    private final RideLockPort rideLockPort;
    private final BookingManager bookingManager;
    private final BookingActivityPublisher bookingActivityPublisher;
    private final MeterRegistry meterRegistry;

    @Override
    public Booking reserveSeat(ReserveSeatCommand command) {
        String ownerToken = UUID.randomUUID().toString();
        if (!rideLockPort.tryLock(command.rideId(), ownerToken)) {
            log.warn("Ride lock wait exceeded: rideId={}, passengerId={}", command.rideId(), command.passengerId());
            record("lock_timeout");
            throw new ConcurrentBookingException(command.rideId());
        }

        BookingOutcome outcome;
        try {
            outcome = bookingManager.reserveInTransaction(command);

        } catch (DataIntegrityViolationException e) {
            // 다른 인스턴스와의 경합: active_booking_key Unique Index 위반
            log.warn("Duplicate booking detected by unique index: rideId={}, passengerId={}",
                    command.rideId(), command.passengerId());
            record("duplicate");
            throw new DuplicateBookingException(command.rideId(), command.passengerId());

        } catch (BusinessException e) {
            log.warn("Seat reservation rejected: rideId={}, passengerId={}, code={}",
                    command.rideId(), command.passengerId(), e.getErrorCode().getCode());
            record(e.getErrorCode().name().toLowerCase());
            throw e;

        } finally {
            rideLockPort.unlock(command.rideId(), ownerToken);
        }

        record("success");
        bookingActivityPublisher.bookingCreated(outcome.booking(), outcome.ride());
        return outcome.booking();
    }

    private void record(String result) {
        meterRegistry.counter(RESERVATION_METRIC, "result", result).increment();
    }
}
