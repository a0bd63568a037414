package personal.hitch.coordination.escrow.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import personal.hitch.coordination.escrow.domain.model.DisputeOutcome;

/**
 * 분쟁 결과 기록 요청 DTO
 */
public record ResolveDisputeRequest(
        @NotNull(message = "중재 결과는 필수입니다.")
        DisputeOutcome outcome
) {
}
