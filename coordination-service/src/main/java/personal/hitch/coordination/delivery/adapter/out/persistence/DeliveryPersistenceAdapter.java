package personal.hitch.coordination.delivery.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.hitch.coordination.delivery.application.port.out.DeliveryRepository;
import personal.hitch.coordination.delivery.domain.model.Delivery;
import personal.hitch.coordination.delivery.domain.model.DeliveryStatus;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Delivery Persistence Adapter
 * DeliveryRepository 구현체
 */
@Component
@RequiredArgsConstructor
public class DeliveryPersistenceAdapter implements DeliveryRepository {

    private final JpaDeliveryRepository jpaDeliveryRepository;

    @Override
    public Optional<Delivery> findById(Long deliveryId) {
        return jpaDeliveryRepository.findById(deliveryId)
                .map(DeliveryEntity::toDomain);
    }

    @Override
    public boolean assignIfUnassigned(Long deliveryId, Long courierId, LocalDateTime acceptedAt) {
        return jpaDeliveryRepository.assignIfUnassigned(
                deliveryId, courierId, acceptedAt, DeliveryStatus.OPEN, DeliveryStatus.ASSIGNED) == 1;
    }

    @Override
    public boolean releaseAssignment(Long deliveryId, Long courierId) {
        return jpaDeliveryRepository.releaseAssignment(
                deliveryId, courierId, DeliveryStatus.ASSIGNED, DeliveryStatus.OPEN) == 1;
    }
}
