package personal.hitch.coordination.booking.application.port.out;

/**
 * 운행 단위 락 Port
 * 같은 운행에 대한 중복 확인과 예약 저장을 직렬화한다.
 * 서로 다른 운행은 서로를 막지 않는다.
 *
 * 구현체:
 * - LocalRideLockAdapter: 프로세스 내 striped ReentrantLock (기본값, 단일 인스턴스)
 * - RedisRideLockAdapter: Redis SETNX + Lua 소유권 검증 해제 (다중 인스턴스)
 */
public interface RideLockPort {

    /**
     * 설정된 대기 시간 안에 락 획득 시도
     *
     * @param rideId     운행 ID
     * @param ownerToken 호출별 소유자 토큰
     * @return 획득 성공 여부
     */
    boolean tryLock(Long rideId, String ownerToken);

    /**
     * 락 해제 (소유자인 경우만)
     */
    void unlock(Long rideId, String ownerToken);

    /**
     * 전략 이름 반환 (로깅/모니터링용)
     */
    String getStrategyName();
}
