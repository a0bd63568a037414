package personal.hitch.coordination.delivery.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.hitch.coordination.delivery.adapter.in.web.dto.DeliveryResponse;
import personal.hitch.coordination.delivery.application.port.in.AcceptDeliveryUseCase;
import personal.hitch.coordination.delivery.application.port.in.CancelDeliveryAssignmentUseCase;

/**
 * Delivery API Controller
 * 배송 수락 및 배정 취소 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/deliveries")
@RequiredArgsConstructor
public class DeliveryController {

    private final AcceptDeliveryUseCase acceptDeliveryUseCase;
    private final CancelDeliveryAssignmentUseCase cancelDeliveryAssignmentUseCase;

    /**
     * 배송 수락
     * POST /api/v1/deliveries/{deliveryId}/accept
     */
    @PostMapping("/{deliveryId}/accept")
    public ResponseEntity<DeliveryResponse> accept(
            @PathVariable Long deliveryId,
            @RequestHeader("X-User-Id") Long courierId
    ) {
        log.info("Accept delivery: deliveryId={}, courierId={}", deliveryId, courierId);
        return ResponseEntity.ok(DeliveryResponse.from(acceptDeliveryUseCase.accept(deliveryId, courierId)));
    }

    /**
     * 배정 취소
     * POST /api/v1/deliveries/{deliveryId}/cancel-assignment
     */
    @PostMapping("/{deliveryId}/cancel-assignment")
    public ResponseEntity<DeliveryResponse> cancelAssignment(
            @PathVariable Long deliveryId,
            @RequestHeader("X-User-Id") Long courierId
    ) {
        log.info("Cancel delivery assignment: deliveryId={}, courierId={}", deliveryId, courierId);
        return ResponseEntity.ok(DeliveryResponse.from(
                cancelDeliveryAssignmentUseCase.cancelAssignment(deliveryId, courierId)));
    }
}
