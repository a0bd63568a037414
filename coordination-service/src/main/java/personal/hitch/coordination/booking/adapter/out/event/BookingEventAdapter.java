package personal.hitch.coordination.booking.adapter.out.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.hitch.coordination.audit.adapter.out.persistence.JpaOutboxEventRepository;
import personal.hitch.coordination.audit.adapter.out.persistence.OutboxEventFactory;
import personal.hitch.coordination.booking.application.port.out.BookingEventPort;
import personal.hitch.coordination.booking.domain.model.Booking;

/**
 * Booking Event Adapter
 * Outbox 패턴을 사용한 예약 이벤트 발행 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventAdapter implements BookingEventPort {

    private static final String AGGREGATE_TYPE = "BOOKING";

    private final JpaOutboxEventRepository jpaOutboxEventRepository;
    private final OutboxEventFactory outboxEventFactory;

    @Override
    public void publishBookingEvent(Booking booking, Long driverId) {
        String eventType = switch (booking.status()) {
            case PENDING -> "BOOKING_CREATED";
            case CONFIRMED -> "BOOKING_CONFIRMED";
            case CANCELLED -> "BOOKING_CANCELLED";
            case COMPLETED -> "BOOKING_COMPLETED";
        };

        BookingAuditEvent event = new BookingAuditEvent(
                booking.id(),
                booking.rideId(),
                booking.passengerId(),
                driverId,
                booking.seats(),
                booking.status().name(),
                String.valueOf(booking.updatedAt()));

        jpaOutboxEventRepository.save(outboxEventFactory.create(AGGREGATE_TYPE, booking.id(), eventType, event));
        log.debug("Booking event stored: bookingId={}, eventType={}", booking.id(), eventType);
    }

    /**
     * Kafka 이벤트 DTO
     */
    public record BookingAuditEvent(
            Long bookingId,
            Long rideId,
            Long passengerId,
            Long driverId,
            int seats,
            String status,
            String occurredAt) {
    }
}
