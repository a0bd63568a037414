package personal.hitch.coordination.escrow.application.port.in;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;
import personal.hitch.coordination.escrow.domain.model.EscrowSubjectType;

import java.math.BigDecimal;

/**
 * 에스크로 생성 Command
 * 금액 검증은 도메인 모델이 담당한다 (InvalidEscrowAmount).
 */
public record CreateEscrowCommand(
        Long payerId,
        BigDecimal amount,
        String currency,
        EscrowSubjectType subjectType,
        Long subjectId
) {
    public CreateEscrowCommand {
        if (payerId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Payer ID cannot be null");
        }
        if (subjectType == null || subjectId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Escrow subject cannot be null");
        }
    }
}
