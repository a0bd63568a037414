package personal.hitch.coordination.escrow.domain.exception;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

import java.math.BigDecimal;

/**
 * Invalid Escrow Amount Exception
 * 예치 금액은 0보다 커야 한다.
 */
public class InvalidEscrowAmountException extends BusinessException {
    public InvalidEscrowAmountException(BigDecimal amount) {
        super(ErrorCode.INVALID_ESCROW_AMOUNT, String.format("Escrow amount must be positive: amount=%s", amount));
    }
}
