package personal.hitch.coordination.escrow.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.hitch.coordination.escrow.application.port.in.CreateEscrowCommand;
import personal.hitch.coordination.escrow.domain.model.EscrowSubjectType;

import java.math.BigDecimal;

/**
 * 에스크로 생성 요청 DTO
 * 금액이 0 이하인 경우는 INVALID_ESCROW_AMOUNT로 거부된다.
 */
public record CreateEscrowRequest(
        @NotNull(message = "금액은 필수입니다.")
        BigDecimal amount,

        @NotBlank(message = "통화는 필수입니다.")
        @Size(min = 3, max = 3, message = "통화는 3자리 코드입니다.")
        String currency,

        @NotNull(message = "대상 종류는 필수입니다.")
        EscrowSubjectType subjectType,

        @NotNull(message = "대상 ID는 필수입니다.")
        Long subjectId
) {
    public CreateEscrowCommand toCommand(Long payerId) {
        return new CreateEscrowCommand(payerId, amount, currency, subjectType, subjectId);
    }
}
