package personal.hitch.coordination.delivery.application.port.out;

import personal.hitch.coordination.delivery.domain.model.Delivery;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 배송 저장소 Port
 */
public interface DeliveryRepository {

    Optional<Delivery> findById(Long deliveryId);

    /**
     * 조건부 배정
     * 배정된 배송원이 없고 OPEN 상태일 때만 배정 (단일 UPDATE)
     *
     * @return 배정 성공 여부
     */
    boolean assignIfUnassigned(Long deliveryId, Long courierId, LocalDateTime acceptedAt);

    /**
     * 조건부 배정 해제
     * 해당 배송원에게 배정된 ASSIGNED 상태일 때만 해제
     */
    boolean releaseAssignment(Long deliveryId, Long courierId);
}
