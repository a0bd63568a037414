package personal.hitch.coordination.delivery.application.port.in;

import personal.hitch.coordination.delivery.domain.model.Delivery;

/**
 * 배송 수락 Use Case
 * 동시 수락 요청 중 정확히 하나만 성공한다.
 */
public interface AcceptDeliveryUseCase {

    Delivery accept(Long deliveryId, Long courierId);
}
