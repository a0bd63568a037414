package personal.hitch.coordination.booking.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import personal.hitch.coordination.booking.application.port.out.RideLockPort;

import java.time.Duration;
import java.util.List;

/**
 * Redis Ride Lock Adapter
 * Redis SETNX 기반 운행 락 구현체
 * Lua Script를 사용한 원자적 락 해제 (소유권 검증)
 *
 * 사용 환경:
 * - 운영 환경 (다중 인스턴스)
 */
@Slf4j
public class RedisRideLockAdapter implements RideLockPort {

    private static final String RIDE_LOCK_PREFIX = "ride:lock:";
    private static final long RETRY_INTERVAL_MS = 20;

    // 락 해제 Lua Script (본인 소유인 경우만 삭제)
    private static final RedisScript<Long> UNLOCK_SCRIPT = new DefaultRedisScript<>("""
            if redis.call('get', KEYS[1]) == ARGV[1] then
                return redis.call('del', KEYS[1])
            end
            return 0
            """, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final Duration lockTtl;
    private final long waitTimeoutMs;

    public RedisRideLockAdapter(StringRedisTemplate redisTemplate, Duration lockTtl, long waitTimeoutMs) {
        this.redisTemplate = redisTemplate;
        this.lockTtl = lockTtl;
        this.waitTimeoutMs = waitTimeoutMs;
    }

    @Override
    public boolean tryLock(Long rideId, String ownerToken) {
        String key = RIDE_LOCK_PREFIX + rideId;
        long deadline = System.currentTimeMillis() + waitTimeoutMs;

        try {
            do {
                // SETNX + TTL을 원자적으로 수행 (setIfAbsent)
                Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key, ownerToken, lockTtl);
                if (Boolean.TRUE.equals(acquired)) {
                    log.debug("[RedisLock] Lock acquired: key={}", key);
                    return true;
                }
                Thread.sleep(RETRY_INTERVAL_MS);
            } while (System.currentTimeMillis() < deadline);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[RedisLock] Interrupted while waiting for lock: key={}", key);
            return false;
        } catch (Exception e) {
            log.error("[RedisLock] Failed to acquire lock: key={}", key, e);
            return false; // 락 획득 실패 시 예약하지 않음 (안전한 방향)
        }

        log.debug("[RedisLock] Lock wait exceeded: key={}", key);
        return false;
    }

    @Override
    public void unlock(Long rideId, String ownerToken) {
        String key = RIDE_LOCK_PREFIX + rideId;

        try {
            Long released = redisTemplate.execute(UNLOCK_SCRIPT, List.of(key), ownerToken);

            if (released != null && released > 0) {
                log.debug("[RedisLock] Lock released: key={}", key);
            } else {
                log.warn("[RedisLock] Lock not released (not owner or expired): key={}", key);
            }
        } catch (Exception e) {
            // TTL에 의해 자동 해제된다
            log.error("[RedisLock] Failed to release lock: key={}", key, e);
        }
    }

    @Override
    public String getStrategyName() {
        return "redis";
    }
}
