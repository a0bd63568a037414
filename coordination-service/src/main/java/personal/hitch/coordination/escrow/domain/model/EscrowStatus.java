package personal.hitch.coordination.escrow.domain.model;

/**
 * 에스크로 상태
 * RELEASED, REFUNDED는 종료 상태로 더 이상 전이할 수 없다.
 */
public enum EscrowStatus {
    CREATED,
    FUNDED,
    DISPUTED,
    RELEASED,
    REFUNDED;

    public boolean isTerminal() {
        return this == RELEASED || this == REFUNDED;
    }
}
