package personal.hitch.coordination.escrow.domain.model;

/**
 * 외부 중재 결과
 */
public enum DisputeOutcome {
    RELEASE(EscrowTransition.RESOLVE_RELEASE),
    REFUND(EscrowTransition.RESOLVE_REFUND);

    private final EscrowTransition transition;

    DisputeOutcome(EscrowTransition transition) {
        this.transition = transition;
    }

    public EscrowTransition transition() {
        return transition;
    }
}
