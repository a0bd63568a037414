package personal.hitch.coordination.escrow.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.hitch.coordination.escrow.domain.model.Escrow;
import personal.hitch.coordination.escrow.domain.model.EscrowStatus;
import personal.hitch.coordination.escrow.domain.model.EscrowSubjectType;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Escrow JPA Entity
 */
@Entity
@Table(name = "escrows",
        indexes = {
                @Index(name = "idx_escrow_status_funded_at", columnList = "status, funded_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EscrowEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "payer_id", nullable = false)
    private Long payerId;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EscrowStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "subject_type", nullable = false, length = 20)
    private EscrowSubjectType subjectType;

    @Column(name = "subject_id", nullable = false)
    private Long subjectId;

    @Column(name = "processor_reference", length = 100)
    private String processorReference;

    @Column(name = "dispute_reason", length = 500)
    private String disputeReason;

    @Column(name = "funded_at")
    private LocalDateTime fundedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public static EscrowEntity fromDomain(Escrow escrow) {
        EscrowEntity entity = new EscrowEntity();
        entity.id = escrow.id();
        entity.payerId = escrow.payerId();
        entity.amount = escrow.amount();
        entity.currency = escrow.currency();
        entity.status = escrow.status();
        entity.subjectType = escrow.subjectType();
        entity.subjectId = escrow.subjectId();
        entity.processorReference = escrow.processorReference();
        entity.disputeReason = escrow.disputeReason();
        entity.fundedAt = escrow.fundedAt();
        entity.createdAt = escrow.createdAt();
        entity.updatedAt = escrow.updatedAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public Escrow toDomain() {
        return new Escrow(id, payerId, amount, currency, status, subjectType, subjectId,
                processorReference, disputeReason, fundedAt, createdAt, updatedAt);
    }
}
