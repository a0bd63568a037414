package personal.hitch.coordination.delivery.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.hitch.coordination.delivery.application.port.out.DeliveryEventPort;
import personal.hitch.coordination.delivery.application.port.out.DeliveryRepository;
import personal.hitch.coordination.delivery.domain.exception.DeliveryAlreadyAssignedException;
import personal.hitch.coordination.delivery.domain.exception.DeliveryNotFoundException;
import personal.hitch.coordination.delivery.domain.model.Delivery;
import personal.hitch.coordination.delivery.domain.model.DeliveryStatus;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("DeliveryAssignmentManager 단위 테스트")
class DeliveryAssignmentManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");
    private static final Long DELIVERY_ID = 7L;
    private static final Long SENDER_ID = 1L;
    private static final Long COURIER_ID = 2L;

    @Mock
    private DeliveryRepository deliveryRepository;
    @Mock
    private DeliveryEventPort deliveryEventPort;

    private DeliveryAssignmentManager manager;

    @BeforeEach
    void setUp() {
        manager = new DeliveryAssignmentManager(deliveryRepository, deliveryEventPort, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Delivery open() {
        return new Delivery(DELIVERY_ID, SENDER_ID, null, DeliveryStatus.OPEN, null,
                LocalDateTime.of(2026, 3, 1, 8, 0));
    }

    @Test
    @DisplayName("배송 수락 성공 - 조건부 배정 후 감사 이벤트 기록")
    void acceptInTransaction_Success() {
        // given
        LocalDateTime now = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);
        given(deliveryRepository.findById(DELIVERY_ID)).willReturn(Optional.of(open()));
        given(deliveryRepository.assignIfUnassigned(DELIVERY_ID, COURIER_ID, now)).willReturn(true);

        // when
        Delivery accepted = manager.acceptInTransaction(DELIVERY_ID, COURIER_ID);

        // then
        assertThat(accepted.assignedCourierId()).isEqualTo(COURIER_ID);
        assertThat(accepted.status()).isEqualTo(DeliveryStatus.ASSIGNED);
        verify(deliveryEventPort).publishAccepted(accepted);
    }

    @Test
    @DisplayName("조건부 배정에서 진 요청은 이미 배정됨으로 실패한다")
    void acceptInTransaction_LostRace() {
        // given
        given(deliveryRepository.findById(DELIVERY_ID)).willReturn(Optional.of(open()));
        given(deliveryRepository.assignIfUnassigned(any(), any(), any())).willReturn(false);

        // when & then
        assertThatThrownBy(() -> manager.acceptInTransaction(DELIVERY_ID, COURIER_ID))
                .isInstanceOf(DeliveryAlreadyAssignedException.class);
        verify(deliveryEventPort, never()).publishAccepted(any());
    }

    @Test
    @DisplayName("존재하지 않는 배송은 수락할 수 없다")
    void acceptInTransaction_NotFound() {
        // given
        given(deliveryRepository.findById(DELIVERY_ID)).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> manager.acceptInTransaction(DELIVERY_ID, COURIER_ID))
                .isInstanceOf(DeliveryNotFoundException.class)
                .hasMessageContaining("deliveryId=" + DELIVERY_ID);
    }

    @Test
    @DisplayName("배정 취소 성공 - 배송이 다시 OPEN이 된다")
    void cancelAssignmentInTransaction_Success() {
        // given
        Delivery assigned = open().assignTo(COURIER_ID, LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
        given(deliveryRepository.findById(DELIVERY_ID)).willReturn(Optional.of(assigned));
        given(deliveryRepository.releaseAssignment(DELIVERY_ID, COURIER_ID)).willReturn(true);

        // when
        Delivery reopened = manager.cancelAssignmentInTransaction(DELIVERY_ID, COURIER_ID);

        // then
        assertThat(reopened.status()).isEqualTo(DeliveryStatus.OPEN);
        assertThat(reopened.assignedCourierId()).isNull();
        verify(deliveryEventPort).publishAssignmentCancelled(reopened, COURIER_ID);
    }
}
