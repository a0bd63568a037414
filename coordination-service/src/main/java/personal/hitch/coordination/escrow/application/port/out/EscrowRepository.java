package personal.hitch.coordination.escrow.application.port.out;

import personal.hitch.coordination.escrow.domain.model.Escrow;
import personal.hitch.coordination.escrow.domain.model.EscrowStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Escrow Repository Port
 */
public interface EscrowRepository {

    Escrow save(Escrow escrow);

    Optional<Escrow> findById(Long escrowId);

    /**
     * 현재 상태가 expected일 때만 updated 내용으로 변경
     *
     * @return 변경 성공 여부
     */
    boolean compareAndSetStatus(Escrow updated, EscrowStatus expected);

    /**
     * fundedBefore 이전에 FUNDED 된 에스크로 ID 목록
     */
    List<Long> findFundedBefore(LocalDateTime fundedBefore, int limit);
}
