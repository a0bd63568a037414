package personal.hitch.coordination.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.hitch.coordination.booking.application.port.out.RideRepository;
import personal.hitch.coordination.booking.domain.model.Ride;
import personal.hitch.coordination.booking.domain.model.RideStatus;

import java.util.Optional;

/**
 * Ride Persistence Adapter
 * RideRepository 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RidePersistenceAdapter implements RideRepository {

    private final JpaRideRepository jpaRideRepository;

    @Override
    public Optional<Ride> findById(Long rideId) {
        return jpaRideRepository.findById(rideId)
                .map(RideEntity::toDomain);
    }

    @Override
    public boolean commitSeats(Long rideId, int seats) {
        int updated = jpaRideRepository.incrementCommittedSeats(rideId, seats);
        if (updated == 0) {
            return false;
        }
        if (jpaRideRepository.markFullIfExhausted(rideId, RideStatus.OPEN, RideStatus.FULL) > 0) {
            log.info("Ride is now full: rideId={}", rideId);
        }
        return true;
    }

    @Override
    public boolean releaseSeats(Long rideId, int seats) {
        int updated = jpaRideRepository.decrementCommittedSeats(rideId, seats);
        if (updated == 0) {
            return false;
        }
        if (jpaRideRepository.reopenIfAvailable(rideId, RideStatus.FULL, RideStatus.OPEN) > 0) {
            log.info("Ride reopened: rideId={}", rideId);
        }
        return true;
    }
}
