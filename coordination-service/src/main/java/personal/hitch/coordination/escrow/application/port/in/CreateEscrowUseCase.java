package personal.hitch.coordination.escrow.application.port.in;

import personal.hitch.coordination.escrow.domain.model.Escrow;

/**
 * 에스크로 생성 Use Case
 */
public interface CreateEscrowUseCase {

    Escrow create(CreateEscrowCommand command);
}
