package personal.hitch.coordination.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.hitch.coordination.booking.domain.model.BookingStatus;

import java.time.LocalDateTime;
import java.util.Collection;

/**
 * Spring Data JPA Repository for Booking
 */
public interface JpaBookingRepository extends JpaRepository<BookingEntity, Long> {

    boolean existsByRideIdAndPassengerIdAndStatusIn(Long rideId, Long passengerId, Collection<BookingStatus> statuses);

    /**
     * 조건부 상태 변경 (현재 상태가 expected에 포함될 때만)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE BookingEntity b SET b.status = :status, b.activeBookingKey = :activeBookingKey, "
            + "b.updatedAt = :updatedAt WHERE b.id = :bookingId AND b.status IN :expected")
    int compareAndSetStatus(@Param("bookingId") Long bookingId,
                            @Param("expected") Collection<BookingStatus> expected,
                            @Param("status") BookingStatus status,
                            @Param("activeBookingKey") String activeBookingKey,
                            @Param("updatedAt") LocalDateTime updatedAt);
}
