package personal.hitch.coordination.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.hitch.coordination.booking.domain.model.Booking;
import personal.hitch.coordination.booking.domain.model.Ride;
import personal.hitch.coordination.notification.application.port.in.NotifyUserUseCase;
import personal.hitch.coordination.notification.domain.model.NotificationType;
import personal.hitch.coordination.room.application.port.in.BroadcastUseCase;
import personal.hitch.coordination.room.domain.model.RealtimeEvent;
import personal.hitch.coordination.room.domain.model.RoomId;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 예약 변경 사항을 운행 Room과 상대방에게 전파
 * 커밋 이후, 락 해제 이후에만 호출된다.
 * 전파 실패는 이미 커밋된 예약 결과를 바꾸지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingActivityPublisher {

    static final String BOOKING_CREATED = "booking_created";
    static final String BOOKING_CONFIRMED = "booking_confirmed";
    static final String BOOKING_CANCELLED = "booking_cancelled";

    private final BroadcastUseCase broadcastUseCase;
    private final NotifyUserUseCase notifyUserUseCase;

    public void bookingCreated(Booking booking, Ride ride) {
        publish(BOOKING_CREATED, booking, ride, ride.driverId(), NotificationType.BOOKING_CREATED,
                "New booking request",
                String.format("%d seat(s) requested on your ride", booking.seats()));
    }

    public void bookingConfirmed(Booking booking, Ride ride) {
        publish(BOOKING_CONFIRMED, booking, ride, booking.passengerId(), NotificationType.BOOKING_CONFIRMED,
                "Booking confirmed",
                "Your driver confirmed the booking");
    }

    /**
     * 취소 요청자가 아닌 쪽에게 알린다.
     */
    public void bookingCancelled(Booking booking, Ride ride, Long cancelledBy) {
        Long counterpart = booking.isPassenger(cancelledBy) ? ride.driverId() : booking.passengerId();
        publish(BOOKING_CANCELLED, booking, ride, counterpart, NotificationType.BOOKING_CANCELLED,
                "Booking cancelled",
                String.format("A booking of %d seat(s) was cancelled", booking.seats()));
    }

    private void publish(String eventType, Booking booking, Ride ride, Long recipientId,
                         NotificationType notificationType, String title, String body) {
        Map<String, Object> payload = payloadOf(booking, ride);
        try {
            broadcastUseCase.broadcast(RoomId.ride(ride.id()), RealtimeEvent.of(eventType, payload));
            notifyUserUseCase.notify(recipientId, notificationType, title, body, payload);
        } catch (RuntimeException e) {
            log.error("Failed to publish booking activity: type={}, bookingId={}, rideId={}",
                    eventType, booking.id(), ride.id(), e);
        }
    }

    private Map<String, Object> payloadOf(Booking booking, Ride ride) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("bookingId", booking.id());
        payload.put("rideId", ride.id());
        payload.put("passengerId", booking.passengerId());
        payload.put("seats", booking.seats());
        payload.put("status", booking.status().name());
        payload.put("remainingSeats", ride.remainingSeats());
        return payload;
    }
}
