package personal.hitch.coordination.escrow.domain.model;

/**
 * 에스크로 대상 (운행 또는 배송)
 */
public enum EscrowSubjectType {
    RIDE,
    PACKAGE
}
