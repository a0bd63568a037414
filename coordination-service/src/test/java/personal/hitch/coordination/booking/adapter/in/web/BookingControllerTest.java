package personal.hitch.coordination.booking.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.hitch.coordination.booking.application.port.in.CancelBookingUseCase;
import personal.hitch.coordination.booking.application.port.in.ConfirmBookingUseCase;
import personal.hitch.coordination.booking.application.port.in.GetRemainingSeatsUseCase;
import personal.hitch.coordination.booking.application.port.in.ReserveSeatCommand;
import personal.hitch.coordination.booking.application.port.in.ReserveSeatUseCase;
import personal.hitch.coordination.booking.domain.exception.InsufficientCapacityException;
import personal.hitch.coordination.booking.domain.model.Booking;
import personal.hitch.coordination.booking.domain.model.BookingStatus;
import personal.hitch.coordination.booking.domain.model.Ride;
import personal.hitch.coordination.booking.domain.model.RideStatus;

import java.time.LocalDateTime;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Booking Controller 단위 테스트
 * @WebMvcTest로 컨트롤러와 전역 예외 처리만 검증
 */
@WebMvcTest(BookingController.class)
@DisplayName("Booking API 단위 테스트")
class BookingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReserveSeatUseCase reserveSeatUseCase;

    @MockBean
    private ConfirmBookingUseCase confirmBookingUseCase;

    @MockBean
    private CancelBookingUseCase cancelBookingUseCase;

    @MockBean
    private GetRemainingSeatsUseCase getRemainingSeatsUseCase;

    @Test
    @DisplayName("좌석 예약 성공 시 201과 예약 정보를 반환한다")
    void reserveSeat_Created() throws Exception {
        // given
        LocalDateTime now = LocalDateTime.of(2026, 10, 19, 9, 0);
        given(reserveSeatUseCase.reserveSeat(any(ReserveSeatCommand.class)))
                .willReturn(new Booking(100L, 1L, 7L, 2, BookingStatus.PENDING, now, now));

        // when & then
        mockMvc.perform(post("/api/v1/rides/1/bookings")
                        .header("X-User-Id", 7L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"seats\":2}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.bookingId").value(100))
                .andExpect(jsonPath("$.seats").value(2))
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    @DisplayName("좌석이 부족하면 409와 B004 코드를 반환한다")
    void reserveSeat_InsufficientCapacity() throws Exception {
        // given
        given(reserveSeatUseCase.reserveSeat(any(ReserveSeatCommand.class)))
                .willThrow(new InsufficientCapacityException(1L, 2, 1));

        // when & then
        mockMvc.perform(post("/api/v1/rides/1/bookings")
                        .header("X-User-Id", 7L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"seats\":2}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("B004"))
                .andExpect(jsonPath("$.detail").value("Not enough seats: rideId=1, requested=2, remaining=1"));
    }

    @Test
    @DisplayName("좌석 수가 0이면 Use Case 호출 없이 400을 반환한다")
    void reserveSeat_InvalidSeats() throws Exception {
        mockMvc.perform(post("/api/v1/rides/1/bookings")
                        .header("X-User-Id", 7L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"seats\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("좌석 수는 1 이상이어야 합니다."));

        verifyNoInteractions(reserveSeatUseCase);
    }

    @Test
    @DisplayName("사용자 헤더가 없으면 401을 반환한다")
    void reserveSeat_MissingUserHeader() throws Exception {
        mockMvc.perform(post("/api/v1/rides/1/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"seats\":1}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("잔여 좌석을 조회한다")
    void getSeats() throws Exception {
        // given
        given(getRemainingSeatsUseCase.getRide(1L))
                .willReturn(new Ride(1L, 3L, 4, 3, RideStatus.OPEN, LocalDateTime.of(2026, 10, 20, 8, 0)));

        // when & then
        mockMvc.perform(get("/api/v1/rides/1/seats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalSeats").value(4))
                .andExpect(jsonPath("$.remainingSeats").value(1))
                .andExpect(jsonPath("$.status").value("OPEN"));
    }
}
