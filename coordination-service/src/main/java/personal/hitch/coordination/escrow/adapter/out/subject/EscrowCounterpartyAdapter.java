package personal.hitch.coordination.escrow.adapter.out.subject;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.hitch.coordination.booking.application.port.out.RideRepository;
import personal.hitch.coordination.booking.domain.model.Ride;
import personal.hitch.coordination.delivery.application.port.out.DeliveryRepository;
import personal.hitch.coordination.delivery.domain.model.Delivery;
import personal.hitch.coordination.escrow.application.port.out.EscrowCounterpartyPort;
import personal.hitch.coordination.escrow.domain.model.EscrowSubjectType;

import java.util.Optional;

/**
 * Escrow Counterparty Adapter
 * 운행/배송 저장소에서 에스크로 대금 수령인을 조회
 */
@Component
@RequiredArgsConstructor
public class EscrowCounterpartyAdapter implements EscrowCounterpartyPort {

    private final RideRepository rideRepository;
    private final DeliveryRepository deliveryRepository;

    @Override
    public Optional<Long> counterpartyOf(EscrowSubjectType subjectType, Long subjectId) {
        return switch (subjectType) {
            case RIDE -> rideRepository.findById(subjectId).map(Ride::driverId);
            case PACKAGE -> deliveryRepository.findById(subjectId).map(Delivery::assignedCourierId);
        };
    }
}
