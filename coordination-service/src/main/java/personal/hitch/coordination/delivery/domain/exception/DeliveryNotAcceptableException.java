package personal.hitch.coordination.delivery.domain.exception;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

/**
 * Delivery Not Acceptable Exception
 * 본인 요청 수락, 취소/완료된 요청 수락 등
 */
public class DeliveryNotAcceptableException extends BusinessException {
    public DeliveryNotAcceptableException(Long deliveryId, String reason) {
        super(ErrorCode.DELIVERY_NOT_ACCEPTABLE,
                String.format("Delivery cannot be accepted: deliveryId=%d, reason=%s", deliveryId, reason));
    }
}
