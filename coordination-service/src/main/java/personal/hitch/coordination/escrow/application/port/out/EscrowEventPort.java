package personal.hitch.coordination.escrow.application.port.out;

import personal.hitch.coordination.escrow.domain.model.Escrow;

/**
 * 에스크로 감사 이벤트 Port
 * 상태 변경과 같은 트랜잭션에서 호출된다.
 */
public interface EscrowEventPort {

    void publishEscrowEvent(Escrow escrow, String eventType);
}
