package personal.hitch.coordination.escrow.adapter.out.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.hitch.coordination.escrow.domain.model.EscrowStatus;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Spring Data JPA Repository for Escrow
 */
public interface JpaEscrowRepository extends JpaRepository<EscrowEntity, Long> {

    /**
     * 조건부 상태 전이 (현재 상태가 expected일 때만)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE EscrowEntity e SET e.status = :status, e.processorReference = :processorReference, "
            + "e.disputeReason = :disputeReason, e.fundedAt = :fundedAt, e.updatedAt = :updatedAt "
            + "WHERE e.id = :escrowId AND e.status = :expected")
    int compareAndSetStatus(@Param("escrowId") Long escrowId,
                            @Param("expected") EscrowStatus expected,
                            @Param("status") EscrowStatus status,
                            @Param("processorReference") String processorReference,
                            @Param("disputeReason") String disputeReason,
                            @Param("fundedAt") LocalDateTime fundedAt,
                            @Param("updatedAt") LocalDateTime updatedAt);

    @Query("SELECT e.id FROM EscrowEntity e WHERE e.status = :status AND e.fundedAt <= :fundedBefore "
            + "ORDER BY e.fundedAt ASC")
    List<Long> findIdsByStatusAndFundedAtBefore(@Param("status") EscrowStatus status,
                                                @Param("fundedBefore") LocalDateTime fundedBefore,
                                                Pageable pageable);
}
