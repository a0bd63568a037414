package personal.hitch.coordination.notification.application.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.hitch.common.exception.UpstreamUnavailableException;
import personal.hitch.coordination.notification.application.port.out.NotificationRepository;
import personal.hitch.coordination.notification.application.port.out.PushNotificationPort;
import personal.hitch.coordination.notification.domain.model.Notification;
import personal.hitch.coordination.notification.domain.model.NotificationType;
import personal.hitch.coordination.notification.domain.model.PushResult;
import personal.hitch.coordination.presence.application.port.out.CredentialVerifier;
import personal.hitch.coordination.presence.application.service.ConnectionRegistry;
import personal.hitch.coordination.presence.application.service.PresenceRegistry;
import personal.hitch.coordination.room.application.service.RoomBroadcastManager;
import personal.hitch.coordination.room.domain.model.RealtimeEvent;
import personal.hitch.coordination.support.RecordingClientConnection;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationDispatcher 단위 테스트")
class NotificationDispatcherTest {

    private static final Long USER_ID = 100L;

    @Mock
    private NotificationRepository notificationRepository;
    @Mock
    private PushNotificationPort pushNotificationPort;
    @Mock
    private CredentialVerifier credentialVerifier;

    private PresenceRegistry presenceRegistry;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        ConnectionRegistry connectionRegistry = new ConnectionRegistry(meterRegistry);
        RoomBroadcastManager roomBroadcastManager = new RoomBroadcastManager(connectionRegistry, List.of(), meterRegistry);
        presenceRegistry = new PresenceRegistry(connectionRegistry, roomBroadcastManager, credentialVerifier, meterRegistry);
        presenceRegistry.start();
        dispatcher = new NotificationDispatcher(notificationRepository, pushNotificationPort, presenceRegistry,
                connectionRegistry, Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC));
    }

    private void givenSaveAssignsId() {
        given(notificationRepository.save(any(Notification.class))).willAnswer(invocation -> {
            Notification toSave = invocation.getArgument(0);
            return new Notification(1L, toSave.userId(), toSave.type(), toSave.title(), toSave.body(),
                    toSave.data(), false, toSave.createdAt());
        });
    }

    private RecordingClientConnection online(String connectionId) {
        RecordingClientConnection connection = new RecordingClientConnection(connectionId);
        presenceRegistry.register(connection);
        given(credentialVerifier.verify("token")).willReturn(USER_ID);
        presenceRegistry.authenticate(connectionId, "token");
        return connection;
    }

    @Test
    @DisplayName("온라인 사용자 - 실시간 연결로 전달하고 푸시는 호출하지 않는다")
    void notify_OnlineUser() {
        // given
        givenSaveAssignsId();
        RecordingClientConnection connection = online("c1");

        // when
        Notification result = dispatcher.notify(USER_ID, NotificationType.BOOKING_CONFIRMED,
                "Booking confirmed", "Your driver confirmed the booking", Map.of("rideId", 42L));

        // then
        assertThat(result.delivered()).isTrue();
        List<RealtimeEvent> events = connection.receivedOfType(NotificationDispatcher.NOTIFICATION_EVENT);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).payload())
                .containsEntry("notificationId", 1L)
                .containsEntry("type", "BOOKING_CONFIRMED");
        verifyNoInteractions(pushNotificationPort);
        verify(notificationRepository).markDelivered(1L);
    }

    @Test
    @DisplayName("오프라인 사용자 - 저장 후 푸시로 전달한다")
    void notify_OfflineUserUsesPush() {
        // given
        givenSaveAssignsId();
        given(pushNotificationPort.push(any(Notification.class))).willReturn(PushResult.DELIVERED);

        // when
        Notification result = dispatcher.notify(USER_ID, NotificationType.ESCROW_RELEASED,
                "Payment released", "30.00 USD payment is now released", Map.of());

        // then
        assertThat(result.delivered()).isTrue();
        InOrder order = inOrder(notificationRepository, pushNotificationPort);
        order.verify(notificationRepository).save(any(Notification.class));
        order.verify(pushNotificationPort).push(any(Notification.class));
        order.verify(notificationRepository).markDelivered(1L);
    }

    @Test
    @DisplayName("실시간 전송이 실패하면 푸시로 대체한다")
    void notify_InBandFailureFallsBackToPush() {
        // given
        givenSaveAssignsId();
        RecordingClientConnection broken = RecordingClientConnection.failing("c1");
        presenceRegistry.register(broken);
        given(credentialVerifier.verify("token")).willReturn(USER_ID);
        presenceRegistry.authenticate("c1", "token");
        given(pushNotificationPort.push(any(Notification.class))).willReturn(PushResult.DELIVERED);

        // when
        Notification result = dispatcher.notify(USER_ID, NotificationType.DELIVERY_ACCEPTED,
                "Courier assigned", "A courier accepted your package", Map.of());

        // then
        assertThat(result.delivered()).isTrue();
        assertThat(broken.isOpen()).isFalse();
        verify(pushNotificationPort).push(any(Notification.class));
    }

    @Test
    @DisplayName("푸시 서비스 장애 - 알림은 저장된 채로 남고 호출자에게 예외가 전파되지 않는다")
    void notify_PushUnavailable() {
        // given
        givenSaveAssignsId();
        given(pushNotificationPort.push(any(Notification.class)))
                .willThrow(new UpstreamUnavailableException("push-service"));

        // when
        Notification result = dispatcher.notify(USER_ID, NotificationType.BOOKING_CANCELLED,
                "Booking cancelled", "A booking of 1 seat(s) was cancelled", Map.of());

        // then
        assertThat(result.id()).isEqualTo(1L);
        assertThat(result.delivered()).isFalse();
        verify(notificationRepository).save(any(Notification.class));
        verify(notificationRepository, never()).markDelivered(any());
    }

    @Test
    @DisplayName("전달할 기기가 없으면 미전달 상태로 남는다")
    void notify_PushUndeliverable() {
        // given
        givenSaveAssignsId();
        given(pushNotificationPort.push(any(Notification.class))).willReturn(PushResult.UNDELIVERABLE);

        // when
        Notification result = dispatcher.notify(USER_ID, NotificationType.ESCROW_FUNDED,
                "Payment funded", "30.00 USD payment is now funded", Map.of());

        // then
        assertThat(result.delivered()).isFalse();
        verify(notificationRepository, never()).markDelivered(any());
    }

    @Test
    @DisplayName("최근 알림 조회 개수는 1~100으로 제한된다")
    void recent_ClampsLimit() {
        // given
        given(notificationRepository.findRecentByUserId(USER_ID, 100)).willReturn(List.of());

        // when
        dispatcher.recent(USER_ID, 1_000);

        // then
        verify(notificationRepository).findRecentByUserId(USER_ID, 100);
    }
}
