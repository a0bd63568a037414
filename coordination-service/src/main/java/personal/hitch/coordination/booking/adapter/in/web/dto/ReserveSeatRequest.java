package personal.hitch.coordination.booking.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import personal.hitch.coordination.booking.application.port.in.ReserveSeatCommand;

/**
 * 좌석 예약 요청 DTO
 */
public record ReserveSeatRequest(
        @NotNull(message = "좌석 수는 필수입니다.")
        @Min(value = 1, message = "좌석 수는 1 이상이어야 합니다.")
        @Max(value = 8, message = "한 번에 예약할 수 있는 좌석은 최대 8석입니다.")
        Integer seats
) {
    public ReserveSeatCommand toCommand(Long rideId, Long passengerId) {
        return new ReserveSeatCommand(rideId, passengerId, seats);
    }
}
