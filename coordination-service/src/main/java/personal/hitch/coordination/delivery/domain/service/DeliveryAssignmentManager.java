package personal.hitch.coordination.delivery.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.hitch.coordination.delivery.application.port.out.DeliveryEventPort;
import personal.hitch.coordination.delivery.application.port.out.DeliveryRepository;
import personal.hitch.coordination.delivery.domain.exception.DeliveryAlreadyAssignedException;
import personal.hitch.coordination.delivery.domain.exception.DeliveryNotFoundException;
import personal.hitch.coordination.delivery.domain.model.Delivery;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Delivery Assignment Domain Service (Transaction Manager)
 * 배정 여부 판단은 조건부 UPDATE 한 번으로 끝나며, 조회는 빠른 실패를 위한 것이다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeliveryAssignmentManager {

    private final DeliveryRepository deliveryRepository;
    private final DeliveryEventPort deliveryEventPort;
    private final Clock clock;

    @Transactional
    public Delivery acceptInTransaction(Long deliveryId, Long courierId) {
        Delivery delivery = findDelivery(deliveryId);
        LocalDateTime now = LocalDateTime.now(clock);

        // 1. 빠른 실패 검증 (본인 요청, 상태, 이미 배정)
        Delivery accepted = delivery.assignTo(courierId, now);

        // 2. 조건부 배정: 경합 시 하나만 1행 갱신
        if (!deliveryRepository.assignIfUnassigned(deliveryId, courierId, now)) {
            log.warn("Delivery acceptance lost the race: deliveryId={}, courierId={}", deliveryId, courierId);
            throw new DeliveryAlreadyAssignedException(deliveryId);
        }

        // 3. 감사 이벤트 (같은 트랜잭션)
        deliveryEventPort.publishAccepted(accepted);

        log.info("Delivery accepted: deliveryId={}, courierId={}", deliveryId, courierId);
        return accepted;
    }

    @Transactional
    public Delivery cancelAssignmentInTransaction(Long deliveryId, Long courierId) {
        Delivery delivery = findDelivery(deliveryId);
        delivery.ensureUnassignableBy(courierId);

        if (!deliveryRepository.releaseAssignment(deliveryId, courierId)) {
            // 그 사이 상태가 바뀌었으면 최신 상태로 다시 검증
            findDelivery(deliveryId).ensureUnassignableBy(courierId);
            throw new IllegalStateException("Delivery assignment changed concurrently: deliveryId=" + deliveryId);
        }

        Delivery reopened = delivery.unassign();
        deliveryEventPort.publishAssignmentCancelled(reopened, courierId);

        log.info("Delivery assignment cancelled: deliveryId={}, courierId={}", deliveryId, courierId);
        return reopened;
    }

    private Delivery findDelivery(Long deliveryId) {
        return deliveryRepository.findById(deliveryId)
                .orElseThrow(() -> new DeliveryNotFoundException(deliveryId));
    }
}
