package personal.hitch.coordination.escrow.adapter.in.web.dto;

import personal.hitch.coordination.escrow.domain.model.Escrow;
import personal.hitch.coordination.escrow.domain.model.EscrowStatus;
import personal.hitch.coordination.escrow.domain.model.EscrowSubjectType;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 에스크로 응답 DTO
 */
public record EscrowResponse(
        Long escrowId,
        Long payerId,
        BigDecimal amount,
        String currency,
        EscrowStatus status,
        EscrowSubjectType subjectType,
        Long subjectId,
        String disputeReason,
        LocalDateTime fundedAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static EscrowResponse from(Escrow escrow) {
        return new EscrowResponse(
                escrow.id(),
                escrow.payerId(),
                escrow.amount(),
                escrow.currency(),
                escrow.status(),
                escrow.subjectType(),
                escrow.subjectId(),
                escrow.disputeReason(),
                escrow.fundedAt(),
                escrow.createdAt(),
                escrow.updatedAt()
        );
    }
}
