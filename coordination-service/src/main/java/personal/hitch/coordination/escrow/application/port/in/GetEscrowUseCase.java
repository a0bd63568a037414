package personal.hitch.coordination.escrow.application.port.in;

import personal.hitch.coordination.escrow.domain.model.Escrow;

/**
 * 에스크로 조회 Use Case
 */
public interface GetEscrowUseCase {

    Escrow getEscrow(Long escrowId);

    /**
     * 자동 정산 대상 여부 (조회 전용, 실제 정산은 release 호출 필요)
     */
    boolean checkAutoRelease(Long escrowId);
}
