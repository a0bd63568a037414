package personal.hitch.coordination.escrow.application.port.in;

import personal.hitch.coordination.escrow.domain.model.DisputeOutcome;
import personal.hitch.coordination.escrow.domain.model.Escrow;

/**
 * 에스크로 상태 전이 Use Case
 * 정의되지 않은 전이는 InvalidEscrowTransitionException,
 * 권한 없는 요청자는 EscrowAccessDeniedException으로 거부된다.
 */
public interface EscrowTransitionUseCase {

    /**
     * 결제 대행사 예치 승인 후 CREATED -> FUNDED
     */
    Escrow fund(Long escrowId, Long requesterId);

    /**
     * 결제자 확인 후 FUNDED -> RELEASED
     */
    Escrow release(Long escrowId, Long requesterId);

    Escrow refund(Long escrowId, Long requesterId);

    Escrow dispute(Long escrowId, Long requesterId, String reason);

    /**
     * 외부 중재 결과 기록 (DISPUTED -> RELEASED | REFUNDED)
     */
    Escrow resolveDispute(Long escrowId, DisputeOutcome outcome);
}
