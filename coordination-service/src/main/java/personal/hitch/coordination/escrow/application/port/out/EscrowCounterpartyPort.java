package personal.hitch.coordination.escrow.application.port.out;

import personal.hitch.coordination.escrow.domain.model.EscrowSubjectType;

import java.util.Optional;

/**
 * 에스크로 거래 상대방 조회 Port
 * 운행은 운전자, 배송은 배정된 배송원이 대금을 받는다.
 */
public interface EscrowCounterpartyPort {

    /**
     * @return 상대방이 아직 정해지지 않았거나 대상이 없으면 empty
     */
    Optional<Long> counterpartyOf(EscrowSubjectType subjectType, Long subjectId);
}
