package personal.hitch.coordination.escrow.domain.exception;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

/**
 * Escrow Funding Declined Exception
 * 결제 대행사가 예치를 거절한 경우 (상태는 CREATED 유지)
 */
public class EscrowFundingDeclinedException extends BusinessException {
    public EscrowFundingDeclinedException(Long escrowId, String reason) {
        super(ErrorCode.ESCROW_FUNDING_DECLINED,
                String.format("Payment processor declined funding: escrowId=%d, reason=%s", escrowId, reason));
    }
}
