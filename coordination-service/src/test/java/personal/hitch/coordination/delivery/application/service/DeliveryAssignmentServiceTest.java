package personal.hitch.coordination.delivery.application.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import personal.hitch.coordination.delivery.domain.exception.DeliveryAlreadyAssignedException;
import personal.hitch.coordination.delivery.domain.model.Delivery;
import personal.hitch.coordination.delivery.domain.model.DeliveryStatus;
import personal.hitch.coordination.delivery.domain.service.DeliveryAssignmentManager;
import personal.hitch.coordination.notification.application.port.in.NotifyUserUseCase;
import personal.hitch.coordination.notification.domain.model.NotificationType;
import personal.hitch.coordination.room.application.port.in.BroadcastUseCase;
import personal.hitch.coordination.room.domain.model.RealtimeEvent;
import personal.hitch.coordination.room.domain.model.RoomId;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("DeliveryAssignmentService 단위 테스트")
class DeliveryAssignmentServiceTest {

    private static final Long DELIVERY_ID = 7L;
    private static final Long SENDER_ID = 1L;
    private static final Long COURIER_ID = 2L;
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 9, 0);

    @Mock
    private DeliveryAssignmentManager deliveryAssignmentManager;
    @Mock
    private BroadcastUseCase broadcastUseCase;
    @Mock
    private NotifyUserUseCase notifyUserUseCase;

    private SimpleMeterRegistry meterRegistry;
    private DeliveryAssignmentService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new DeliveryAssignmentService(deliveryAssignmentManager, broadcastUseCase, notifyUserUseCase, meterRegistry);
    }

    private Delivery assigned() {
        return new Delivery(DELIVERY_ID, SENDER_ID, COURIER_ID, DeliveryStatus.ASSIGNED, NOW, NOW);
    }

    @Test
    @DisplayName("수락 성공 - 배송 Room 브로드캐스트와 발송인 알림")
    void accept_Success() {
        // given
        given(deliveryAssignmentManager.acceptInTransaction(DELIVERY_ID, COURIER_ID)).willReturn(assigned());

        // when
        Delivery result = service.accept(DELIVERY_ID, COURIER_ID);

        // then
        assertThat(result.assignedCourierId()).isEqualTo(COURIER_ID);
        ArgumentCaptor<RealtimeEvent> event = ArgumentCaptor.forClass(RealtimeEvent.class);
        verify(broadcastUseCase).broadcast(eq(RoomId.pkg(DELIVERY_ID)), event.capture());
        assertThat(event.getValue().type()).isEqualTo("delivery_accepted");
        assertThat(event.getValue().payload()).containsEntry("courierId", COURIER_ID);
        verify(notifyUserUseCase).notify(eq(SENDER_ID), eq(NotificationType.DELIVERY_ACCEPTED),
                anyString(), anyString(), anyMap());
        assertThat(meterRegistry.counter("delivery.accept", "result", "success").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("수락 실패 - 이미 배정된 배송은 아무것도 전파하지 않는다")
    void accept_AlreadyAssigned() {
        // given
        given(deliveryAssignmentManager.acceptInTransaction(DELIVERY_ID, COURIER_ID))
                .willThrow(new DeliveryAlreadyAssignedException(DELIVERY_ID));

        // when & then
        assertThatThrownBy(() -> service.accept(DELIVERY_ID, COURIER_ID))
                .isInstanceOf(DeliveryAlreadyAssignedException.class);
        verifyNoInteractions(broadcastUseCase, notifyUserUseCase);
        assertThat(meterRegistry.counter("delivery.accept", "result", "delivery_already_assigned").count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("행 락 경합은 재시도되어 최신 상태 기준으로 판정된다")
    void accept_RetriesOnLockContention() {
        // given
        given(deliveryAssignmentManager.acceptInTransaction(DELIVERY_ID, COURIER_ID))
                .willThrow(new CannotAcquireLockException("row locked"))
                .willReturn(assigned());

        // when
        Delivery result = service.accept(DELIVERY_ID, COURIER_ID);

        // then
        assertThat(result.status()).isEqualTo(DeliveryStatus.ASSIGNED);
        verify(deliveryAssignmentManager, times(2)).acceptInTransaction(DELIVERY_ID, COURIER_ID);
    }

    @Test
    @DisplayName("알림 실패는 이미 커밋된 수락 결과를 바꾸지 않는다")
    void accept_NotificationFailureIgnored() {
        // given
        given(deliveryAssignmentManager.acceptInTransaction(DELIVERY_ID, COURIER_ID)).willReturn(assigned());
        given(notifyUserUseCase.notify(any(), any(), anyString(), anyString(), anyMap()))
                .willThrow(new IllegalStateException("notification store down"));

        // when
        Delivery result = service.accept(DELIVERY_ID, COURIER_ID);

        // then
        assertThat(result.assignedCourierId()).isEqualTo(COURIER_ID);
    }

    @Test
    @DisplayName("배정 취소 - 배송 Room과 발송인에게 전파")
    void cancelAssignment_Success() {
        // given
        Delivery reopened = new Delivery(DELIVERY_ID, SENDER_ID, null, DeliveryStatus.OPEN, null, NOW);
        given(deliveryAssignmentManager.cancelAssignmentInTransaction(DELIVERY_ID, COURIER_ID)).willReturn(reopened);

        // when
        Delivery result = service.cancelAssignment(DELIVERY_ID, COURIER_ID);

        // then
        assertThat(result.status()).isEqualTo(DeliveryStatus.OPEN);
        verify(notifyUserUseCase).notify(eq(SENDER_ID), eq(NotificationType.DELIVERY_ASSIGNMENT_CANCELLED),
                anyString(), anyString(), anyMap());
    }
}
