package personal.hitch.coordination.booking.application.port.in;

import personal.hitch.coordination.booking.domain.model.Booking;

/**
 * 좌석 예약 Use Case
 * 잔여 좌석 확인과 좌석 확보를 하나의 원자적 단계로 수행
 */
public interface ReserveSeatUseCase {

    Booking reserveSeat(ReserveSeatCommand command);
}
