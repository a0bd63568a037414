package personal.hitch.coordination.escrow.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.hitch.coordination.escrow.application.port.out.EscrowEventPort;
import personal.hitch.coordination.escrow.application.port.out.EscrowRepository;
import personal.hitch.coordination.escrow.domain.exception.EscrowNotFoundException;
import personal.hitch.coordination.escrow.domain.exception.InvalidEscrowTransitionException;
import personal.hitch.coordination.escrow.domain.model.Escrow;
import personal.hitch.coordination.escrow.domain.model.EscrowTransition;

import java.time.LocalDateTime;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Escrow State Machine (Transaction Manager)
 * 전이 하나당 트랜잭션 하나, 대상 행 하나만 조건부로 갱신한다.
 * 외부 결제 대행사 호출은 이 클래스 밖(트랜잭션 밖)에서 이루어진다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EscrowStateMachine {

    private final EscrowRepository escrowRepository;
    private final EscrowEventPort escrowEventPort;

    @Transactional
    public Escrow createInTransaction(Escrow escrow) {
        Escrow saved = escrowRepository.save(escrow);
        escrowEventPort.publishEscrowEvent(saved, "ESCROW_CREATED");

        log.info("Escrow created: escrowId={}, payerId={}, amount={} {}",
                saved.id(), saved.payerId(), saved.amount(), saved.currency());
        return saved;
    }

    /**
     * 상태 전이 커밋
     * 조건부 UPDATE (WHERE status = 출발 상태)에 실패하면 최신 상태로 InvalidEscrowTransition을 던진다.
     *
     * @param change 현재 Escrow에 전이를 적용하는 함수 (허용되지 않으면 예외)
     */
    @Transactional
    public Escrow commit(Long escrowId, EscrowTransition transition, UnaryOperator<Escrow> change) {
        Escrow current = findEscrow(escrowId);
        Escrow next = change.apply(current);

        if (!escrowRepository.compareAndSetStatus(next, transition.from())) {
            Escrow latest = findEscrow(escrowId);
            log.warn("Escrow transition lost the race: escrowId={}, transition={}, current={}",
                    escrowId, transition, latest.status());
            throw new InvalidEscrowTransitionException(escrowId, latest.status(), transition);
        }
        escrowEventPort.publishEscrowEvent(next, "ESCROW_" + next.status().name());

        log.info("Escrow transition committed: escrowId={}, {} -> {}", escrowId, transition.from(), next.status());
        return next;
    }

    @Transactional(readOnly = true)
    public Escrow findEscrow(Long escrowId) {
        return escrowRepository.findById(escrowId)
                .orElseThrow(() -> new EscrowNotFoundException(escrowId));
    }

    @Transactional(readOnly = true)
    public List<Long> findFundedBefore(LocalDateTime fundedBefore, int limit) {
        return escrowRepository.findFundedBefore(fundedBefore, limit);
    }
}
