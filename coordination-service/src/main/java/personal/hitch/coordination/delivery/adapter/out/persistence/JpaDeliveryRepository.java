package personal.hitch.coordination.delivery.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.hitch.coordination.delivery.domain.model.DeliveryStatus;

import java.time.LocalDateTime;

/**
 * Spring Data JPA Repository for Delivery
 */
public interface JpaDeliveryRepository extends JpaRepository<DeliveryEntity, Long> {

    /**
     * 조건부 배정 (assigned_courier_id IS NULL 인 경우에만)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DeliveryEntity d SET d.assignedCourierId = :courierId, d.status = :assigned, "
            + "d.acceptedAt = :acceptedAt "
            + "WHERE d.id = :deliveryId AND d.assignedCourierId IS NULL AND d.status = :open")
    int assignIfUnassigned(@Param("deliveryId") Long deliveryId,
                           @Param("courierId") Long courierId,
                           @Param("acceptedAt") LocalDateTime acceptedAt,
                           @Param("open") DeliveryStatus open,
                           @Param("assigned") DeliveryStatus assigned);

    /**
     * 조건부 배정 해제 (해당 배송원에게 배정된 경우에만)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DeliveryEntity d SET d.assignedCourierId = NULL, d.status = :open, d.acceptedAt = NULL "
            + "WHERE d.id = :deliveryId AND d.assignedCourierId = :courierId AND d.status = :assigned")
    int releaseAssignment(@Param("deliveryId") Long deliveryId,
                          @Param("courierId") Long courierId,
                          @Param("assigned") DeliveryStatus assigned,
                          @Param("open") DeliveryStatus open);
}
