package personal.hitch.coordination.delivery.application.port.in;

import personal.hitch.coordination.delivery.domain.model.Delivery;

/**
 * 배송 배정 취소 Use Case (배정된 배송원 본인)
 */
public interface CancelDeliveryAssignmentUseCase {

    Delivery cancelAssignment(Long deliveryId, Long courierId);
}
