package personal.hitch.coordination.delivery.domain.exception;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

/**
 * Delivery Access Denied Exception
 * 배정된 배송원이 아닌 사용자가 배정을 취소하려는 경우
 */
public class DeliveryAccessDeniedException extends BusinessException {
    public DeliveryAccessDeniedException(Long deliveryId, Long userId) {
        super(ErrorCode.FORBIDDEN,
                String.format("User is not the assigned courier: deliveryId=%d, userId=%d", deliveryId, userId));
    }
}
