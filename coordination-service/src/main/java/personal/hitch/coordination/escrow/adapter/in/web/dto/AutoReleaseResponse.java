package personal.hitch.coordination.escrow.adapter.in.web.dto;

/**
 * 자동 정산 대상 여부 응답 DTO
 */
public record AutoReleaseResponse(Long escrowId, boolean eligible) {
}
