package personal.hitch.coordination.escrow.application.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;
import personal.hitch.coordination.escrow.application.port.in.AutoReleaseEscrowsUseCase;
import personal.hitch.coordination.escrow.application.port.in.CreateEscrowCommand;
import personal.hitch.coordination.escrow.application.port.in.CreateEscrowUseCase;
import personal.hitch.coordination.escrow.application.port.in.EscrowTransitionUseCase;
import personal.hitch.coordination.escrow.application.port.in.GetEscrowUseCase;
import personal.hitch.coordination.escrow.application.port.out.EscrowCounterpartyPort;
import personal.hitch.coordination.escrow.application.port.out.PaymentProcessorPort;
import personal.hitch.coordination.escrow.domain.exception.EscrowAccessDeniedException;
import personal.hitch.coordination.escrow.domain.exception.InvalidEscrowTransitionException;
import personal.hitch.coordination.escrow.domain.model.DisputeOutcome;
import personal.hitch.coordination.escrow.domain.model.Escrow;
import personal.hitch.coordination.escrow.domain.model.EscrowTransition;
import personal.hitch.coordination.escrow.domain.service.EscrowStateMachine;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Escrow Service
 * 예치 결제 상태 전이 진입점
 *
 * fund 흐름:
 * 1. 요청자(결제자)와 현재 상태로 빠른 실패 검증 (CREATED가 아니면 대행사 호출 없이 거부)
 * 2. 결제 대행사 예치 요청 (트랜잭션 밖)
 * 3. 승인된 경우에만 FUNDED 커밋, 실패하면 CREATED 유지 (재시도 가능)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EscrowService implements CreateEscrowUseCase, EscrowTransitionUseCase,
        GetEscrowUseCase, AutoReleaseEscrowsUseCase {

    private final EscrowStateMachine escrowStateMachine;
    private final PaymentProcessorPort paymentProcessorPort;
    private final EscrowCounterpartyPort escrowCounterpartyPort;
    private final EscrowActivityPublisher escrowActivityPublisher;
    private final EscrowAutoReleaseProperties autoReleaseProperties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Override
    public Escrow create(CreateEscrowCommand command) {
        Escrow escrow = Escrow.create(command.payerId(), command.amount(), command.currency(),
                command.subjectType(), command.subjectId(), LocalDateTime.now(clock));
        return escrowStateMachine.createInTransaction(escrow);
    }

    @Override
    public Escrow fund(Long escrowId, Long requesterId) {
        Escrow escrow = authorizedEscrow(escrowId, EscrowTransition.FUND, requesterId);
        escrow.ensureAllowed(EscrowTransition.FUND);

        String processorReference = paymentProcessorPort.hold(escrow);
        log.info("Payment processor approved hold: escrowId={}, reference={}", escrowId, processorReference);

        return transition(escrowId, EscrowTransition.FUND,
                current -> current.fund(processorReference, LocalDateTime.now(clock)));
    }

    @Override
    public Escrow release(Long escrowId, Long requesterId) {
        authorizedEscrow(escrowId, EscrowTransition.RELEASE, requesterId);
        return apply(escrowId, EscrowTransition.RELEASE);
    }

    @Override
    public Escrow refund(Long escrowId, Long requesterId) {
        authorizedEscrow(escrowId, EscrowTransition.REFUND, requesterId);
        return apply(escrowId, EscrowTransition.REFUND);
    }

    @Override
    public Escrow dispute(Long escrowId, Long requesterId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Dispute reason cannot be blank");
        }
        authorizedEscrow(escrowId, EscrowTransition.DISPUTE, requesterId);
        return transition(escrowId, EscrowTransition.DISPUTE,
                current -> current.dispute(reason, LocalDateTime.now(clock)));
    }

    @Override
    public Escrow resolveDispute(Long escrowId, DisputeOutcome outcome) {
        if (outcome == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Dispute outcome cannot be null");
        }
        return apply(escrowId, outcome.transition());
    }

    @Override
    public Escrow getEscrow(Long escrowId) {
        return escrowStateMachine.findEscrow(escrowId);
    }

    @Override
    public boolean checkAutoRelease(Long escrowId) {
        return escrowStateMachine.findEscrow(escrowId)
                .isEligibleForAutoRelease(LocalDateTime.now(clock), autoReleaseProperties.getGracePeriod());
    }

    /**
     * 유예 기간이 지난 FUNDED 에스크로 정산
     * 그 사이 분쟁이 제기된 건은 전이 실패로 건너뛴다.
     */
    @Override
    public int releaseEligible() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(autoReleaseProperties.getGracePeriod());
        List<Long> candidates = escrowStateMachine.findFundedBefore(cutoff, autoReleaseProperties.getSweepBatchSize());

        int released = 0;
        for (Long escrowId : candidates) {
            try {
                apply(escrowId, EscrowTransition.RELEASE);
                released++;
            } catch (InvalidEscrowTransitionException e) {
                log.debug("Escrow no longer eligible for auto release: escrowId={}, current={}",
                        escrowId, e.getCurrentStatus());
            }
        }
        return released;
    }

    /**
     * 요청자 검증
     * 결제자가 아니면 거래 상대방을 조회해 환불/분쟁 권한을 확인한다.
     */
    private Escrow authorizedEscrow(Long escrowId, EscrowTransition transition, Long requesterId) {
        Escrow escrow = escrowStateMachine.findEscrow(escrowId);
        Long counterpartyId = escrow.isPayer(requesterId)
                ? null
                : escrowCounterpartyPort.counterpartyOf(escrow.subjectType(), escrow.subjectId()).orElse(null);
        try {
            escrow.ensureRequestableBy(transition, requesterId, counterpartyId);
        } catch (EscrowAccessDeniedException e) {
            meterRegistry.counter("escrow.transitions", "transition", transition.name().toLowerCase(),
                    "result", "forbidden").increment();
            throw e;
        }
        return escrow;
    }

    private Escrow apply(Long escrowId, EscrowTransition transition) {
        return transition(escrowId, transition, current -> current.apply(transition, LocalDateTime.now(clock)));
    }

    private Escrow transition(Long escrowId, EscrowTransition transition, UnaryOperator<Escrow> change) {
        Escrow next;
        try {
            next = escrowStateMachine.commit(escrowId, transition, change);
        } catch (BusinessException e) {
            meterRegistry.counter("escrow.transitions", "transition", transition.name().toLowerCase(),
                    "result", e.getErrorCode().name().toLowerCase()).increment();
            throw e;
        }
        meterRegistry.counter("escrow.transitions", "transition", transition.name().toLowerCase(),
                "result", "success").increment();

        escrowActivityPublisher.transitioned(next, transition);
        return next;
    }
}
