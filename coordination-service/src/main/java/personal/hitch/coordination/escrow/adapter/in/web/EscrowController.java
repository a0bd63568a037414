package personal.hitch.coordination.escrow.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.hitch.coordination.escrow.adapter.in.web.dto.AutoReleaseResponse;
import personal.hitch.coordination.escrow.adapter.in.web.dto.CreateEscrowRequest;
import personal.hitch.coordination.escrow.adapter.in.web.dto.DisputeRequest;
import personal.hitch.coordination.escrow.adapter.in.web.dto.EscrowResponse;
import personal.hitch.coordination.escrow.adapter.in.web.dto.ResolveDisputeRequest;
import personal.hitch.coordination.escrow.application.port.in.CreateEscrowUseCase;
import personal.hitch.coordination.escrow.application.port.in.EscrowTransitionUseCase;
import personal.hitch.coordination.escrow.application.port.in.GetEscrowUseCase;

/**
 * Escrow API Controller
 * 에스크로 생성, 상태 전이, 자동 정산 대상 조회 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/escrows")
@RequiredArgsConstructor
public class EscrowController {

    private final CreateEscrowUseCase createEscrowUseCase;
    private final EscrowTransitionUseCase escrowTransitionUseCase;
    private final GetEscrowUseCase getEscrowUseCase;

    /**
     * 에스크로 생성
     * POST /api/v1/escrows
     */
    @PostMapping
    public ResponseEntity<EscrowResponse> create(
            @Valid @RequestBody CreateEscrowRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Create escrow: payerId={}, amount={} {}, subject={}:{}",
                userId, request.amount(), request.currency(), request.subjectType(), request.subjectId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(EscrowResponse.from(createEscrowUseCase.create(request.toCommand(userId))));
    }

    @GetMapping("/{escrowId}")
    public ResponseEntity<EscrowResponse> get(@PathVariable Long escrowId) {
        return ResponseEntity.ok(EscrowResponse.from(getEscrowUseCase.getEscrow(escrowId)));
    }

    /**
     * 예치 (결제 대행사 승인 후 FUNDED)
     * POST /api/v1/escrows/{escrowId}/fund
     */
    @PostMapping("/{escrowId}/fund")
    public ResponseEntity<EscrowResponse> fund(
            @PathVariable Long escrowId,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Fund escrow: escrowId={}, userId={}", escrowId, userId);
        return ResponseEntity.ok(EscrowResponse.from(escrowTransitionUseCase.fund(escrowId, userId)));
    }

    /**
     * 정산 (결제자만)
     * POST /api/v1/escrows/{escrowId}/release
     */
    @PostMapping("/{escrowId}/release")
    public ResponseEntity<EscrowResponse> release(
            @PathVariable Long escrowId,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Release escrow: escrowId={}, userId={}", escrowId, userId);
        return ResponseEntity.ok(EscrowResponse.from(escrowTransitionUseCase.release(escrowId, userId)));
    }

    @PostMapping("/{escrowId}/refund")
    public ResponseEntity<EscrowResponse> refund(
            @PathVariable Long escrowId,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Refund escrow: escrowId={}, userId={}", escrowId, userId);
        return ResponseEntity.ok(EscrowResponse.from(escrowTransitionUseCase.refund(escrowId, userId)));
    }

    @PostMapping("/{escrowId}/dispute")
    public ResponseEntity<EscrowResponse> dispute(
            @PathVariable Long escrowId,
            @RequestHeader("X-User-Id") Long userId,
            @Valid @RequestBody DisputeRequest request
    ) {
        log.info("Dispute escrow: escrowId={}, userId={}", escrowId, userId);
        return ResponseEntity.ok(EscrowResponse.from(
                escrowTransitionUseCase.dispute(escrowId, userId, request.reason())));
    }

    /**
     * 외부 중재 결과 기록
     * POST /api/v1/escrows/{escrowId}/resolve
     */
    @PostMapping("/{escrowId}/resolve")
    public ResponseEntity<EscrowResponse> resolve(
            @PathVariable Long escrowId,
            @Valid @RequestBody ResolveDisputeRequest request
    ) {
        log.info("Resolve escrow dispute: escrowId={}, outcome={}", escrowId, request.outcome());
        return ResponseEntity.ok(EscrowResponse.from(
                escrowTransitionUseCase.resolveDispute(escrowId, request.outcome())));
    }

    /**
     * 자동 정산 대상 여부
     * GET /api/v1/escrows/{escrowId}/auto-release
     */
    @GetMapping("/{escrowId}/auto-release")
    public ResponseEntity<AutoReleaseResponse> checkAutoRelease(@PathVariable Long escrowId) {
        return ResponseEntity.ok(new AutoReleaseResponse(escrowId, getEscrowUseCase.checkAutoRelease(escrowId)));
    }
}
