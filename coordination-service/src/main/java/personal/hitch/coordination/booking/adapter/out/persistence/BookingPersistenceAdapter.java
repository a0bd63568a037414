package personal.hitch.coordination.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.hitch.coordination.booking.application.port.out.BookingRepository;
import personal.hitch.coordination.booking.domain.model.Booking;
import personal.hitch.coordination.booking.domain.model.BookingStatus;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Booking Persistence Adapter
 * BookingRepository 구현체
 */
@Component
@RequiredArgsConstructor
public class BookingPersistenceAdapter implements BookingRepository {

    private static final Set<BookingStatus> ACTIVE = EnumSet.of(BookingStatus.PENDING, BookingStatus.CONFIRMED);

    private final JpaBookingRepository jpaBookingRepository;

    @Override
    public Booking save(Booking booking) {
        // saveAndFlush: Unique Index 위반을 트랜잭션 안에서 즉시 감지
        BookingEntity saved = jpaBookingRepository.saveAndFlush(BookingEntity.fromDomain(booking));
        return saved.toDomain();
    }

    @Override
    public Optional<Booking> findById(Long bookingId) {
        return jpaBookingRepository.findById(bookingId)
                .map(BookingEntity::toDomain);
    }

    @Override
    public boolean existsActiveBooking(Long rideId, Long passengerId) {
        return jpaBookingRepository.existsByRideIdAndPassengerIdAndStatusIn(rideId, passengerId, ACTIVE);
    }

    @Override
    public boolean compareAndSetStatus(Booking updated, Set<BookingStatus> expected) {
        int rows = jpaBookingRepository.compareAndSetStatus(
                updated.id(),
                expected,
                updated.status(),
                updated.activeBookingKey(),
                updated.updatedAt());
        return rows == 1;
    }
}
