package personal.hitch.coordination.escrow.domain.model;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;
import personal.hitch.coordination.escrow.domain.exception.EscrowAccessDeniedException;
import personal.hitch.coordination.escrow.domain.exception.InvalidEscrowAmountException;
import personal.hitch.coordination.escrow.domain.exception.InvalidEscrowTransitionException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Escrow Domain Model
 * 예치 결제 도메인 모델 (불변)
 * 상태 변경은 EscrowTransition 표에 정의된 전이로만 가능하다.
 */
public record Escrow(
        Long id,
        Long payerId,
        BigDecimal amount,
        String currency,
        EscrowStatus status,
        EscrowSubjectType subjectType,
        Long subjectId,
        String processorReference,
        String disputeReason,
        LocalDateTime fundedAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt) {

    public Escrow {
        if (payerId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Payer ID cannot be null");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidEscrowAmountException(amount);
        }
        if (currency == null || currency.length() != 3) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Currency must be a 3-letter code");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Escrow status cannot be null");
        }
        if (subjectType == null || subjectId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Escrow subject cannot be null");
        }
    }

    public static Escrow create(Long payerId, BigDecimal amount, String currency,
                                EscrowSubjectType subjectType, Long subjectId, LocalDateTime now) {
        return new Escrow(null, payerId, amount, currency == null ? null : currency.toUpperCase(),
                EscrowStatus.CREATED, subjectType, subjectId, null, null, null, now, now);
    }

    /**
     * CREATED -> FUNDED (결제 대행사 승인 이후)
     */
    public Escrow fund(String processorReference, LocalDateTime now) {
        ensureAllowed(EscrowTransition.FUND);
        return new Escrow(id, payerId, amount, currency, EscrowStatus.FUNDED, subjectType, subjectId,
                processorReference, disputeReason, now, createdAt, now);
    }

    /**
     * 예치 상태 전이 (FUND 제외)
     */
    public Escrow apply(EscrowTransition transition, LocalDateTime now) {
        if (transition == EscrowTransition.FUND) {
            throw new IllegalArgumentException("FUND requires a processor reference");
        }
        if (transition == EscrowTransition.DISPUTE) {
            throw new IllegalArgumentException("DISPUTE requires a reason");
        }
        ensureAllowed(transition);
        return withStatus(transition.to(), disputeReason, now);
    }

    /**
     * FUNDED -> DISPUTED
     */
    public Escrow dispute(String reason, LocalDateTime now) {
        ensureAllowed(EscrowTransition.DISPUTE);
        return withStatus(EscrowStatus.DISPUTED, reason, now);
    }

    // ========== Domain Validation Methods (Tell, Don't Ask) ==========

    /**
     * 전이 가능 여부 검증
     *
     * @throws InvalidEscrowTransitionException 현재 상태에서 정의되지 않은 전이
     */
    public void ensureAllowed(EscrowTransition transition) {
        if (!transition.isAllowedFrom(status)) {
            throw new InvalidEscrowTransitionException(id, status, transition);
        }
    }

    /**
     * 전이 요청자 검증
     * 예치/정산은 결제자만, 환불/분쟁은 결제자 또는 거래 상대방이 요청할 수 있다.
     *
     * @param counterpartyId 대금 수령인 (미정이면 null)
     * @throws EscrowAccessDeniedException 권한 없는 사용자
     */
    public void ensureRequestableBy(EscrowTransition transition, Long requesterId, Long counterpartyId) {
        if (isPayer(requesterId)) {
            return;
        }
        boolean counterpartyAllowed = transition == EscrowTransition.REFUND || transition == EscrowTransition.DISPUTE;
        if (!counterpartyAllowed || counterpartyId == null || !counterpartyId.equals(requesterId)) {
            throw new EscrowAccessDeniedException(id, requesterId, transition);
        }
    }

    public boolean isPayer(Long userId) {
        return payerId.equals(userId);
    }

    /**
     * 자동 정산 대상 여부
     * FUNDED 상태로 유예 기간 이상 분쟁 없이 유지된 경우
     */
    public boolean isEligibleForAutoRelease(LocalDateTime now, Duration gracePeriod) {
        return status == EscrowStatus.FUNDED
                && fundedAt != null
                && !fundedAt.plus(gracePeriod).isAfter(now);
    }

    private Escrow withStatus(EscrowStatus next, String reason, LocalDateTime now) {
        return new Escrow(id, payerId, amount, currency, next, subjectType, subjectId,
                processorReference, reason, fundedAt, createdAt, now);
    }
}
