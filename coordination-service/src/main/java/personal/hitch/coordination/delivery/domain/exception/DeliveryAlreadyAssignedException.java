package personal.hitch.coordination.delivery.domain.exception;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

/**
 * Delivery Already Assigned Exception
 * 다른 배송원이 먼저 수락한 경우 발생
 * HTTP 409 Conflict 반환용
 */
public class DeliveryAlreadyAssignedException extends BusinessException {
    public DeliveryAlreadyAssignedException(Long deliveryId) {
        super(ErrorCode.DELIVERY_ALREADY_ASSIGNED,
                String.format("Delivery already assigned to another courier: deliveryId=%d", deliveryId));
    }
}
