package personal.hitch.coordination.escrow.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import personal.hitch.coordination.escrow.application.port.out.EscrowRepository;
import personal.hitch.coordination.escrow.domain.model.Escrow;
import personal.hitch.coordination.escrow.domain.model.EscrowStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Escrow Persistence Adapter
 * EscrowRepository 구현체
 */
@Component
@RequiredArgsConstructor
public class EscrowPersistenceAdapter implements EscrowRepository {

    private final JpaEscrowRepository jpaEscrowRepository;

    @Override
    public Escrow save(Escrow escrow) {
        return jpaEscrowRepository.saveAndFlush(EscrowEntity.fromDomain(escrow)).toDomain();
    }

    @Override
    public Optional<Escrow> findById(Long escrowId) {
        return jpaEscrowRepository.findById(escrowId)
                .map(EscrowEntity::toDomain);
    }

    @Override
    public boolean compareAndSetStatus(Escrow updated, EscrowStatus expected) {
        return jpaEscrowRepository.compareAndSetStatus(
                updated.id(),
                expected,
                updated.status(),
                updated.processorReference(),
                updated.disputeReason(),
                updated.fundedAt(),
                updated.updatedAt()) == 1;
    }

    @Override
    public List<Long> findFundedBefore(LocalDateTime fundedBefore, int limit) {
        return jpaEscrowRepository.findIdsByStatusAndFundedAtBefore(
                EscrowStatus.FUNDED, fundedBefore, PageRequest.of(0, limit));
    }
}
