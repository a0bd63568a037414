package personal.hitch.coordination.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.hitch.coordination.booking.application.port.in.ReserveSeatCommand;
import personal.hitch.coordination.booking.application.port.out.BookingEventPort;
import personal.hitch.coordination.booking.application.port.out.BookingRepository;
import personal.hitch.coordination.booking.application.port.out.RideRepository;
import personal.hitch.coordination.booking.domain.exception.BookingAccessDeniedException;
import personal.hitch.coordination.booking.domain.exception.BookingNotFoundException;
import personal.hitch.coordination.booking.domain.exception.CapacityInvariantViolationException;
import personal.hitch.coordination.booking.domain.exception.ConcurrentBookingException;
import personal.hitch.coordination.booking.domain.exception.DuplicateBookingException;
import personal.hitch.coordination.booking.domain.exception.InsufficientCapacityException;
import personal.hitch.coordination.booking.domain.exception.RideNotFoundException;
import personal.hitch.coordination.booking.domain.model.Booking;
import personal.hitch.coordination.booking.domain.model.BookingOutcome;
import personal.hitch.coordination.booking.domain.model.BookingStatus;
import personal.hitch.coordination.booking.domain.model.Ride;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Booking Domain Service (Transaction Manager)
 * 트랜잭션 범위 분리를 위한 실행 전용 서비스
 * 락, 브로드캐스트, 알림은 호출하는 Application Service가 트랜잭션 밖에서 처리한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingManager {

    private static final Set<BookingStatus> CANCELLABLE = EnumSet.of(BookingStatus.PENDING, BookingStatus.CONFIRMED);

    private final RideRepository rideRepository;
    private final BookingRepository bookingRepository;
    private final BookingEventPort bookingEventPort;
    private final Clock clock;

    /**
     * 트랜잭션 내에서 좌석 확보 및 예약 저장
     * 조건부 UPDATE가 최종 방어선이고, active_booking_key Unique Index가 중복 예약의 2차 방어선이다.
     */
    @Transactional
    public BookingOutcome reserveInTransaction(ReserveSeatCommand command) {
        LocalDateTime now = LocalDateTime.now(clock);

        // 1. 운행 조회 및 예약 가능 검증
        Ride ride = rideRepository.findById(command.rideId())
                .orElseThrow(() -> new RideNotFoundException(command.rideId()));
        ride.ensureBookableBy(command.passengerId(), now);

        // 2. 중복 예약 확인
        if (bookingRepository.existsActiveBooking(command.rideId(), command.passengerId())) {
            throw new DuplicateBookingException(command.rideId(), command.passengerId());
        }

        // 3. 조건부 좌석 확보 (check-and-commit 단일 UPDATE)
        if (!rideRepository.commitSeats(command.rideId(), command.seats())) {
            int remaining = rideRepository.findById(command.rideId())
                    .map(Ride::remainingSeats)
                    .orElse(0);
            throw new InsufficientCapacityException(command.rideId(), command.seats(), remaining);
        }

        Ride committedRide = rideRepository.findById(command.rideId())
                .orElseThrow(() -> new RideNotFoundException(command.rideId()));
        committedRide.ensureCapacityInvariant();

        // 4. 예약 저장 + Outbox 이벤트
        Booking saved = bookingRepository.save(
                Booking.create(command.rideId(), command.passengerId(), command.seats(), now));
        bookingEventPort.publishBookingEvent(saved, ride.driverId());

        log.info("Seats committed: bookingId={}, rideId={}, seats={}, remaining={}",
                saved.id(), ride.id(), saved.seats(), committedRide.remainingSeats());
        return BookingOutcome.changed(saved, committedRide);
    }

    /**
     * 예약 확정 (운전자 전용)
     */
    @Transactional
    public BookingOutcome confirmInTransaction(Long bookingId, Long driverId) {
        Booking booking = findBooking(bookingId);
        Ride ride = findRide(booking.rideId());
        if (!ride.isDriver(driverId)) {
            throw new BookingAccessDeniedException(bookingId, driverId);
        }

        Booking confirmed = booking.confirm(LocalDateTime.now(clock));
        if (!bookingRepository.compareAndSetStatus(confirmed, EnumSet.of(BookingStatus.PENDING))) {
            // 동시에 취소된 경우: 최신 상태 기준으로 다시 검증
            findBooking(bookingId).confirm(LocalDateTime.now(clock));
            throw new ConcurrentBookingException(ride.id());
        }
        bookingEventPort.publishBookingEvent(confirmed, ride.driverId());

        log.info("Booking confirmed: bookingId={}, rideId={}", bookingId, ride.id());
        return BookingOutcome.changed(confirmed, ride);
    }

    /**
     * 예약 취소 및 좌석 반환
     * 이미 취소된 예약은 변경 없이 반환한다 (멱등성).
     * 상태 변경에 성공한 요청만 좌석을 반환하므로 이중 반환이 없다.
     */
    @Transactional
    public BookingOutcome cancelInTransaction(Long bookingId, Long requesterId) {
        Booking booking = findBooking(bookingId);
        Ride ride = findRide(booking.rideId());
        if (!booking.isPassenger(requesterId) && !ride.isDriver(requesterId)) {
            throw new BookingAccessDeniedException(bookingId, requesterId);
        }

        if (booking.isCancelled()) {
            log.debug("Booking already cancelled: bookingId={}", bookingId);
            return BookingOutcome.unchanged(booking, ride);
        }

        Booking cancelled = booking.cancel(LocalDateTime.now(clock));
        if (!bookingRepository.compareAndSetStatus(cancelled, CANCELLABLE)) {
            Booking latest = findBooking(bookingId);
            if (latest.isCancelled()) {
                return BookingOutcome.unchanged(latest, ride);
            }
            // COMPLETED 등 취소 불가 상태면 여기서 실패, 아니면 재시도 대상
            latest.cancel(LocalDateTime.now(clock));
            throw new ConcurrentBookingException(ride.id());
        }

        if (!rideRepository.releaseSeats(ride.id(), booking.seats())) {
            throw new CapacityInvariantViolationException(String.format(
                    "Releasing more seats than committed: rideId=%d, bookingId=%d, seats=%d",
                    ride.id(), bookingId, booking.seats()));
        }
        Ride releasedRide = findRide(ride.id());
        releasedRide.ensureCapacityInvariant();
        bookingEventPort.publishBookingEvent(cancelled, ride.driverId());

        log.info("Booking cancelled: bookingId={}, rideId={}, releasedSeats={}, remaining={}",
                bookingId, ride.id(), booking.seats(), releasedRide.remainingSeats());
        return BookingOutcome.changed(cancelled, releasedRide);
    }

    @Transactional(readOnly = true)
    public Ride findRide(Long rideId) {
        return rideRepository.findById(rideId)
                .orElseThrow(() -> new RideNotFoundException(rideId));
    }

    private Booking findBooking(Long bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
    }
}
