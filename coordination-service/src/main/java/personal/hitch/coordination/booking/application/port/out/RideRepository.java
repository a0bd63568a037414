package personal.hitch.coordination.booking.application.port.out;

import personal.hitch.coordination.booking.domain.model.Ride;

import java.util.Optional;

/**
 * 운행 저장소 Port
 */
public interface RideRepository {

    Optional<Ride> findById(Long rideId);

    /**
     * 조건부 좌석 확보
     * committedSeats + seats <= totalSeats 인 경우에만 증가 (단일 UPDATE)
     *
     * @return 확보 성공 여부
     */
    boolean commitSeats(Long rideId, int seats);

    /**
     * 조건부 좌석 반환
     * committedSeats >= seats 인 경우에만 감소
     *
     * @return 반환 성공 여부 (false는 불변식 위반)
     */
    boolean releaseSeats(Long rideId, int seats);
}
