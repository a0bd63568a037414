package personal.hitch.coordination.delivery.application.port.out;

import personal.hitch.coordination.delivery.domain.model.Delivery;

/**
 * 배송 배정 감사 이벤트 Port (Outbox)
 */
public interface DeliveryEventPort {

    void publishAccepted(Delivery delivery);

    void publishAssignmentCancelled(Delivery delivery, Long courierId);
}
