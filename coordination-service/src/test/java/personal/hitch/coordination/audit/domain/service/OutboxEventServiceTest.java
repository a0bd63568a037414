package personal.hitch.coordination.audit.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.hitch.coordination.audit.application.config.OutboxPublisherProperties;
import personal.hitch.coordination.audit.application.port.out.AuditEventPublisher;
import personal.hitch.coordination.audit.application.port.out.OutboxEventRepository;
import personal.hitch.coordination.audit.domain.model.OutboxEvent;
import personal.hitch.coordination.audit.domain.model.OutboxEvent.OutboxEventStatus;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutboxEventService 단위 테스트")
class OutboxEventServiceTest {

    @Mock
    private OutboxEventRepository outboxEventRepository;

    @Mock
    private AuditEventPublisher eventPublisher;

    private OutboxEventService outboxEventService;

    @BeforeEach
    void setUp() {
        OutboxPublisherProperties properties = new OutboxPublisherProperties();
        properties.setBatchSize(50);
        properties.setMaxRetries(3);
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T00:00:00Z"), ZoneId.of("UTC"));
        outboxEventService = new OutboxEventService(outboxEventRepository, eventPublisher, properties, clock);
    }

    private static OutboxEvent pending(Long id, String aggregateType, Long aggregateId, String eventType, int retryCount) {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, "{\"id\":" + aggregateId + "}",
                OutboxEventStatus.PENDING, LocalDateTime.now(), null, retryCount, null);
    }

    @Test
    @DisplayName("Aggregate 종류와 이벤트 종류로 토픽을 결정한다")
    void mapToTopic() {
        assertThat(outboxEventService.mapToTopic("BOOKING", "BOOKING_RESERVED")).isEqualTo("booking.events");
        assertThat(outboxEventService.mapToTopic("DELIVERY", "DELIVERY_ACCEPTED")).isEqualTo("delivery.events");
        assertThat(outboxEventService.mapToTopic("ESCROW", "ESCROW_FUNDED")).isEqualTo("escrow.events");
        assertThat(outboxEventService.mapToTopic("RIDE", "LOCATION_UPDATED")).isEqualTo("realtime.location");
        assertThat(outboxEventService.mapToTopic("GROUP", "MESSAGE_SENT")).isEqualTo("realtime.chat");
        assertThat(outboxEventService.mapToTopic("CALL", "MESSAGE_SENT")).isEqualTo("realtime.chat");
    }

    @Test
    @DisplayName("알 수 없는 Aggregate 종류는 토픽을 결정할 수 없다")
    void mapToTopic_Unknown() {
        assertThatThrownBy(() -> outboxEventService.mapToTopic("USER", "CREATED"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("USER");
    }

    @Test
    @DisplayName("발행에 성공한 이벤트는 PUBLISHED로 저장되고 Aggregate 키로 발행된다")
    void publishPendingEvents_Success() {
        // given
        OutboxEvent event = pending(1L, "BOOKING", 10L, "BOOKING_RESERVED", 0);
        given(outboxEventRepository.findPending(50)).willReturn(List.of(event));

        // when
        int published = outboxEventService.publishPendingEvents();

        // then
        assertThat(published).isEqualTo(1);
        verify(eventPublisher).publishRaw("booking.events", "BOOKING:10", "{\"id\":10}");
        ArgumentCaptor<OutboxEvent> saved = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxEventRepository).save(saved.capture());
        assertThat(saved.getValue().status()).isEqualTo(OutboxEventStatus.PUBLISHED);
        assertThat(saved.getValue().publishedAt()).isEqualTo(LocalDateTime.of(2026, 10, 19, 0, 0));
    }

    @Test
    @DisplayName("발행 실패 시 재시도 횟수만 증가하고 나머지 이벤트는 계속 처리된다")
    void publishPendingEvents_FailureIsolated() {
        // given
        OutboxEvent failing = pending(1L, "ESCROW", 3L, "ESCROW_FUNDED", 0);
        OutboxEvent healthy = pending(2L, "DELIVERY", 4L, "DELIVERY_ACCEPTED", 0);
        given(outboxEventRepository.findPending(50)).willReturn(List.of(failing, healthy));
        willThrow(new IllegalStateException("broker down"))
                .given(eventPublisher).publishRaw("escrow.events", "ESCROW:3", failing.payload());

        // when
        int published = outboxEventService.publishPendingEvents();

        // then
        assertThat(published).isEqualTo(1);
        ArgumentCaptor<OutboxEvent> saved = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxEventRepository, times(2)).save(saved.capture());
        assertThat(saved.getAllValues().get(0).status()).isEqualTo(OutboxEventStatus.PENDING);
        assertThat(saved.getAllValues().get(0).retryCount()).isEqualTo(1);
        assertThat(saved.getAllValues().get(0).lastError()).isEqualTo("broker down");
        assertThat(saved.getAllValues().get(1).status()).isEqualTo(OutboxEventStatus.PUBLISHED);
    }

    @Test
    @DisplayName("재시도 한도에 도달하면 FAILED로 표시된다")
    void publishPendingEvents_MarksFailedAfterMaxRetries() {
        // given
        OutboxEvent event = pending(1L, "BOOKING", 10L, "BOOKING_CANCELLED", 2);
        given(outboxEventRepository.findPending(50)).willReturn(List.of(event));
        willThrow(new IllegalStateException("broker down"))
                .given(eventPublisher).publishRaw("booking.events", "BOOKING:10", event.payload());

        // when
        int published = outboxEventService.publishPendingEvents();

        // then
        assertThat(published).isZero();
        ArgumentCaptor<OutboxEvent> saved = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxEventRepository).save(saved.capture());
        assertThat(saved.getValue().status()).isEqualTo(OutboxEventStatus.FAILED);
        assertThat(saved.getValue().retryCount()).isEqualTo(3);
    }
}
