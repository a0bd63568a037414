package personal.hitch.coordination.booking.application.port.out;

import personal.hitch.coordination.booking.domain.model.Booking;
import personal.hitch.coordination.booking.domain.model.BookingStatus;

import java.util.Optional;
import java.util.Set;

/**
 * 예약 저장소 Port
 */
public interface BookingRepository {

    Booking save(Booking booking);

    Optional<Booking> findById(Long bookingId);

    boolean existsActiveBooking(Long rideId, Long passengerId);

    /**
     * 조건부 상태 변경
     * 현재 상태가 expected 중 하나일 때만 updated의 상태로 변경
     *
     * @return 변경 성공 여부 (false면 다른 요청이 먼저 상태를 바꿨음)
     */
    boolean compareAndSetStatus(Booking updated, Set<BookingStatus> expected);
}
