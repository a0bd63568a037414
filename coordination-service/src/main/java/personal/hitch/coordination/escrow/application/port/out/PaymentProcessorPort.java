package personal.hitch.coordination.escrow.application.port.out;

import personal.hitch.coordination.escrow.domain.model.Escrow;

/**
 * 외부 결제 대행사 Port
 */
public interface PaymentProcessorPort {

    /**
     * 예치 승인 요청
     *
     * @return 결제 대행사 참조 번호
     * @throws personal.hitch.coordination.escrow.domain.exception.EscrowFundingDeclinedException 승인 거절
     * @throws personal.hitch.common.exception.UpstreamUnavailableException 결제 대행사 장애
     */
    String hold(Escrow escrow);
}
