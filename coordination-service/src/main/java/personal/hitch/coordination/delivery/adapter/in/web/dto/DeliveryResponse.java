package personal.hitch.coordination.delivery.adapter.in.web.dto;

import personal.hitch.coordination.delivery.domain.model.Delivery;
import personal.hitch.coordination.delivery.domain.model.DeliveryStatus;

import java.time.LocalDateTime;

/**
 * 배송 응답 DTO
 */
public record DeliveryResponse(
        Long deliveryId,
        Long senderId,
        Long assignedCourierId,
        DeliveryStatus status,
        LocalDateTime acceptedAt
) {
    public static DeliveryResponse from(Delivery delivery) {
        return new DeliveryResponse(
                delivery.id(),
                delivery.senderId(),
                delivery.assignedCourierId(),
                delivery.status(),
                delivery.acceptedAt()
        );
    }
}
