package personal.hitch.coordination.delivery.application.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import personal.hitch.common.exception.BusinessException;
import personal.hitch.coordination.delivery.application.port.in.AcceptDeliveryUseCase;
import personal.hitch.coordination.delivery.application.port.in.CancelDeliveryAssignmentUseCase;
import personal.hitch.coordination.delivery.domain.model.Delivery;
import personal.hitch.coordination.delivery.domain.service.DeliveryAssignmentManager;
import personal.hitch.coordination.notification.application.port.in.NotifyUserUseCase;
import personal.hitch.coordination.notification.domain.model.NotificationType;
import personal.hitch.coordination.room.application.port.in.BroadcastUseCase;
import personal.hitch.coordination.room.domain.model.RealtimeEvent;
import personal.hitch.coordination.room.domain.model.RoomId;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Delivery Assignment Service
 * 배송 수락/배정 취소 후 배송 Room과 발송인에게 결과를 전파
 *
 * DB 락 경합(ConcurrencyFailureException)은 재시도하며, 재시도 시 최신 상태 기준으로 판정된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryAssignmentService implements AcceptDeliveryUseCase, CancelDeliveryAssignmentUseCase {

    static final String DELIVERY_ACCEPTED = "delivery_accepted";
    static final String DELIVERY_ASSIGNMENT_CANCELLED = "delivery_assignment_cancelled";
    private static final int MAX_ATTEMPTS = 3;

    private final DeliveryAssignmentManager deliveryAssignmentManager;
    private final BroadcastUseCase broadcastUseCase;
    private final NotifyUserUseCase notifyUserUseCase;
    private final MeterRegistry meterRegistry;

    @Override
    public Delivery accept(Long deliveryId, Long courierId) {
        Delivery accepted;
        try {
            accepted = withRetry(() -> deliveryAssignmentManager.acceptInTransaction(deliveryId, courierId));
        } catch (BusinessException e) {
            meterRegistry.counter("delivery.accept", "result", e.getErrorCode().name().toLowerCase()).increment();
            throw e;
        }
        meterRegistry.counter("delivery.accept", "result", "success").increment();

        publish(DELIVERY_ACCEPTED, accepted, courierId, NotificationType.DELIVERY_ACCEPTED,
                "Courier assigned", "A courier accepted your package");
        return accepted;
    }

    @Override
    public Delivery cancelAssignment(Long deliveryId, Long courierId) {
        Delivery reopened = withRetry(
                () -> deliveryAssignmentManager.cancelAssignmentInTransaction(deliveryId, courierId));

        publish(DELIVERY_ASSIGNMENT_CANCELLED, reopened, courierId, NotificationType.DELIVERY_ASSIGNMENT_CANCELLED,
                "Courier cancelled", "Your package is open for couriers again");
        return reopened;
    }

    private Delivery withRetry(Supplier<Delivery> action) {
        ConcurrencyFailureException lastFailure = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                return action.get();
            } catch (ConcurrencyFailureException e) {
                lastFailure = e;
                log.debug("Delivery row contention, retrying: attempt={}", attempt);
            }
        }
        throw lastFailure;
    }

    private void publish(String eventType, Delivery delivery, Long courierId,
                         NotificationType notificationType, String title, String body) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("deliveryId", delivery.id());
        payload.put("courierId", courierId);
        payload.put("status", delivery.status().name());
        try {
            broadcastUseCase.broadcast(RoomId.pkg(delivery.id()), RealtimeEvent.of(eventType, payload));
            notifyUserUseCase.notify(delivery.senderId(), notificationType, title, body, payload);
        } catch (RuntimeException e) {
            log.error("Failed to publish delivery activity: type={}, deliveryId={}", eventType, delivery.id(), e);
        }
    }
}
