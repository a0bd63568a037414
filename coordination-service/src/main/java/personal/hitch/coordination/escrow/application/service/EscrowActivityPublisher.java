package personal.hitch.coordination.escrow.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.hitch.coordination.escrow.domain.model.Escrow;
import personal.hitch.coordination.escrow.domain.model.EscrowSubjectType;
import personal.hitch.coordination.escrow.domain.model.EscrowTransition;
import personal.hitch.coordination.notification.application.port.in.NotifyUserUseCase;
import personal.hitch.coordination.notification.domain.model.NotificationType;
import personal.hitch.coordination.room.application.port.in.BroadcastUseCase;
import personal.hitch.coordination.room.domain.model.RealtimeEvent;
import personal.hitch.coordination.room.domain.model.RoomId;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 에스크로 상태 전이를 대상 Room과 결제자에게 전파
 * 전파 실패는 커밋된 전이를 되돌리지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EscrowActivityPublisher {

    private final BroadcastUseCase broadcastUseCase;
    private final NotifyUserUseCase notifyUserUseCase;

    public void transitioned(Escrow escrow, EscrowTransition transition) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("escrowId", escrow.id());
        payload.put("status", escrow.status().name());
        payload.put("amount", escrow.amount().toPlainString());
        payload.put("currency", escrow.currency());
        payload.put("subjectType", escrow.subjectType().name());
        payload.put("subjectId", escrow.subjectId());

        try {
            broadcastUseCase.broadcast(roomOf(escrow), RealtimeEvent.of(transition.eventName(), payload));
            notifyUserUseCase.notify(escrow.payerId(), notificationTypeOf(transition),
                    "Payment " + escrow.status().name().toLowerCase(),
                    String.format("%s %s payment is now %s", escrow.amount().toPlainString(), escrow.currency(),
                            escrow.status().name().toLowerCase()),
                    payload);
        } catch (RuntimeException e) {
            log.error("Failed to publish escrow activity: escrowId={}, transition={}", escrow.id(), transition, e);
        }
    }

    private RoomId roomOf(Escrow escrow) {
        return escrow.subjectType() == EscrowSubjectType.RIDE
                ? RoomId.ride(escrow.subjectId())
                : RoomId.pkg(escrow.subjectId());
    }

    private NotificationType notificationTypeOf(EscrowTransition transition) {
        return switch (transition) {
            case FUND -> NotificationType.ESCROW_FUNDED;
            case RELEASE, RESOLVE_RELEASE -> NotificationType.ESCROW_RELEASED;
            case REFUND, RESOLVE_REFUND -> NotificationType.ESCROW_REFUNDED;
            case DISPUTE -> NotificationType.ESCROW_DISPUTED;
        };
    }
}
