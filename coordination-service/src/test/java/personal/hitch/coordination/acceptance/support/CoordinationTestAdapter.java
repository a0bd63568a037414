package personal.hitch.coordination.acceptance.support;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.hitch.coordination.audit.adapter.out.persistence.JpaOutboxEventRepository;
import personal.hitch.coordination.audit.adapter.out.persistence.OutboxEventEntity;
import personal.hitch.coordination.booking.adapter.out.persistence.JpaBookingRepository;
import personal.hitch.coordination.booking.adapter.out.persistence.JpaRideRepository;
import personal.hitch.coordination.booking.adapter.out.persistence.RideEntity;
import personal.hitch.coordination.booking.domain.model.Ride;
import personal.hitch.coordination.booking.domain.model.RideStatus;
import personal.hitch.coordination.delivery.adapter.out.persistence.DeliveryEntity;
import personal.hitch.coordination.delivery.adapter.out.persistence.JpaDeliveryRepository;
import personal.hitch.coordination.delivery.domain.model.Delivery;
import personal.hitch.coordination.delivery.domain.model.DeliveryStatus;
import personal.hitch.coordination.escrow.adapter.out.persistence.JpaEscrowRepository;
import personal.hitch.coordination.notification.adapter.out.persistence.JpaNotificationRepository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 인수 테스트 데이터 어댑터
 * 운행, 배송 요청은 외부 시스템이 생성하므로 저장소에 직접 준비한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CoordinationTestAdapter {

    private final JpaRideRepository rideRepository;
    private final JpaBookingRepository bookingRepository;
    private final JpaDeliveryRepository deliveryRepository;
    private final JpaEscrowRepository escrowRepository;
    private final JpaNotificationRepository notificationRepository;
    private final JpaOutboxEventRepository outboxRepository;

    /**
     * 모든 테스트 데이터 초기화 (시나리오 시작 시)
     */
    public void clearAllData() {
        log.info(">>> Adapter: 모든 테스트 데이터 초기화");
        outboxRepository.deleteAll();
        notificationRepository.deleteAll();
        escrowRepository.deleteAll();
        bookingRepository.deleteAll();
        rideRepository.deleteAll();
        deliveryRepository.deleteAll();
    }

    public Long createRide(Long driverId, int totalSeats) {
        Ride ride = new Ride(null, driverId, totalSeats, 0, RideStatus.OPEN, LocalDateTime.now().plusDays(1));
        Long rideId = rideRepository.save(RideEntity.fromDomain(ride)).getId();
        log.info(">>> Adapter: 운행 생성 - rideId={}, driverId={}, seats={}", rideId, driverId, totalSeats);
        return rideId;
    }

    public Long createDelivery(Long senderId) {
        Delivery delivery = new Delivery(null, senderId, null, DeliveryStatus.OPEN, null, LocalDateTime.now());
        Long deliveryId = deliveryRepository.save(DeliveryEntity.fromDomain(delivery)).getId();
        log.info(">>> Adapter: 배송 요청 생성 - deliveryId={}, senderId={}", deliveryId, senderId);
        return deliveryId;
    }

    /**
     * 기록된 감사 이벤트의 Aggregate ID 목록 (저장 순)
     */
    public List<Long> auditedAggregateIds(String aggregateType, String eventType) {
        return outboxRepository.findByAggregateTypeAndEventTypeOrderByIdAsc(aggregateType, eventType).stream()
                .map(OutboxEventEntity::getAggregateId)
                .toList();
    }
}
