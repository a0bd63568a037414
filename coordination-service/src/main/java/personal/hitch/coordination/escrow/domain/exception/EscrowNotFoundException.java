package personal.hitch.coordination.escrow.domain.exception;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

/**
 * Escrow Not Found Exception
 */
public class EscrowNotFoundException extends BusinessException {
    public EscrowNotFoundException(Long escrowId) {
        super(ErrorCode.ESCROW_NOT_FOUND, String.format("Escrow not found: escrowId=%d", escrowId));
    }
}
