package personal.hitch.coordination.escrow.domain.exception;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;
import personal.hitch.coordination.escrow.domain.model.EscrowTransition;

/**
 * Escrow Access Denied Exception
 * 결제자나 거래 상대방이 아닌 사용자가 에스크로 전이를 요청할 때 발생
 */
public class EscrowAccessDeniedException extends BusinessException {
    public EscrowAccessDeniedException(Long escrowId, Long userId, EscrowTransition transition) {
        super(ErrorCode.FORBIDDEN, String.format("User cannot %s escrow: escrowId=%d, userId=%d",
                transition.name().toLowerCase(), escrowId, userId));
    }
}
