package personal.hitch.coordination.escrow.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 분쟁 제기 요청 DTO
 */
public record DisputeRequest(
        @NotBlank(message = "분쟁 사유는 필수입니다.")
        @Size(max = 500, message = "분쟁 사유는 500자 이하입니다.")
        String reason
) {
}
