package personal.hitch.coordination.booking.adapter.out.lock;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Ride Lock 설정 Properties
 *
 * 설정 예시:
 * capacity:
 *   lock:
 *     strategy: redis        # local | redis
 *     wait-timeout-ms: 2000  # 락 대기 시간
 *     ttl-seconds: 10        # Redis 락 TTL
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "capacity.lock")
public class RideLockProperties {

    /**
     * 락 전략
     * - local: 프로세스 내 striped lock (단일 인스턴스)
     * - redis: Redis 분산 락 (다중 인스턴스)
     */
    private String strategy = "local";

    /**
     * 락 획득 대기 시간 (ms), 초과 시 ConcurrentBookingException
     */
    private long waitTimeoutMs = 2000;

    /**
     * Redis 락 TTL (초)
     * 예약 트랜잭션 최대 실행 시간 + 안전 마진
     */
    private int ttlSeconds = 10;

    /**
     * local 전략의 stripe 수
     */
    private int stripes = 256;
}
