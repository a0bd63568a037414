package personal.hitch.coordination.escrow.domain.model;

/**
 * 에스크로 상태 전이 표
 * 각 전이는 하나의 출발 상태에서만 허용된다.
 */
public enum EscrowTransition {
    FUND(EscrowStatus.CREATED, EscrowStatus.FUNDED),
    RELEASE(EscrowStatus.FUNDED, EscrowStatus.RELEASED),
    REFUND(EscrowStatus.FUNDED, EscrowStatus.REFUNDED),
    DISPUTE(EscrowStatus.FUNDED, EscrowStatus.DISPUTED),
    RESOLVE_RELEASE(EscrowStatus.DISPUTED, EscrowStatus.RELEASED),
    RESOLVE_REFUND(EscrowStatus.DISPUTED, EscrowStatus.REFUNDED);

    private final EscrowStatus from;
    private final EscrowStatus to;

    EscrowTransition(EscrowStatus from, EscrowStatus to) {
        this.from = from;
        this.to = to;
    }

    public EscrowStatus from() {
        return from;
    }

    public EscrowStatus to() {
        return to;
    }

    public boolean isAllowedFrom(EscrowStatus current) {
        return from == current;
    }

    /**
     * 실시간 이벤트 이름 (escrow_funded 등)
     */
    public String eventName() {
        return "escrow_" + to.name().toLowerCase();
    }
}
