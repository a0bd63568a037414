package personal.hitch.coordination.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.hitch.coordination.booking.domain.model.RideStatus;

/**
 * Spring Data JPA Repository for Ride
 */
public interface JpaRideRepository extends JpaRepository<RideEntity, Long> {

    /**
     * 조건부 좌석 확보 (check-and-commit)
     * 잔여 좌석이 충분할 때만 1행이 갱신된다.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RideEntity r SET r.committedSeats = r.committedSeats + :seats "
            + "WHERE r.id = :rideId AND r.committedSeats + :seats <= r.totalSeats")
    int incrementCommittedSeats(@Param("rideId") Long rideId, @Param("seats") int seats);

    /**
     * 조건부 좌석 반환
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RideEntity r SET r.committedSeats = r.committedSeats - :seats "
            + "WHERE r.id = :rideId AND r.committedSeats >= :seats")
    int decrementCommittedSeats(@Param("rideId") Long rideId, @Param("seats") int seats);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RideEntity r SET r.status = :next "
            + "WHERE r.id = :rideId AND r.status = :expected AND r.committedSeats >= r.totalSeats")
    int markFullIfExhausted(@Param("rideId") Long rideId,
                            @Param("expected") RideStatus expected,
                            @Param("next") RideStatus next);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RideEntity r SET r.status = :next "
            + "WHERE r.id = :rideId AND r.status = :expected AND r.committedSeats < r.totalSeats")
    int reopenIfAvailable(@Param("rideId") Long rideId,
                          @Param("expected") RideStatus expected,
                          @Param("next") RideStatus next);
}
