package personal.hitch.coordination.escrow.application.port.in;

/**
 * 자동 정산 대상 에스크로 일괄 정산 Use Case
 */
public interface AutoReleaseEscrowsUseCase {

    /**
     * @return 정산된 건수
     */
    int releaseEligible();
}
