package personal.hitch.coordination.escrow.domain.exception;

import lombok.Getter;
import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;
import personal.hitch.coordination.escrow.domain.model.EscrowStatus;
import personal.hitch.coordination.escrow.domain.model.EscrowTransition;

/**
 * Invalid Escrow Transition Exception
 * 현재 상태와 시도한 전이를 함께 전달한다.
 */
@Getter
public class InvalidEscrowTransitionException extends BusinessException {

    private final EscrowStatus currentStatus;
    private final EscrowTransition attempted;

    public InvalidEscrowTransitionException(Long escrowId, EscrowStatus currentStatus, EscrowTransition attempted) {
        super(ErrorCode.INVALID_ESCROW_TRANSITION,
                String.format("Cannot %s escrow in state %s: escrowId=%s",
                        attempted.name().toLowerCase(), currentStatus.name().toLowerCase(), escrowId));
        this.currentStatus = currentStatus;
        this.attempted = attempted;
    }
}
