package personal.hitch.coordination.delivery.domain.exception;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

/**
 * Delivery Not Found Exception
 */
public class DeliveryNotFoundException extends BusinessException {
    public DeliveryNotFoundException(Long deliveryId) {
        super(ErrorCode.DELIVERY_NOT_FOUND, String.format("Delivery not found: deliveryId=%d", deliveryId));
    }
}
