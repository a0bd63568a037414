package personal.hitch.coordination.booking.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import personal.hitch.coordination.booking.application.port.out.RideLockPort;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Local Ride Lock Adapter
 * 운행 ID 해시로 고른 stripe의 ReentrantLock을 사용하는 어댑터
 *
 * 사용 환경:
 * - 로컬 개발, 테스트
 * - 단일 인스턴스 운영
 *
 * 주의: 다중 인스턴스 환경에서는 redis 전략 사용 (조건부 UPDATE가 최종 방어선으로 남는다)
 */
@Slf4j
public class LocalRideLockAdapter implements RideLockPort {

    private final ReentrantLock[] stripes;
    private final long waitTimeoutMs;

    public LocalRideLockAdapter(int stripeCount, long waitTimeoutMs) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("Stripe count must be positive");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock(true);
        }
        this.waitTimeoutMs = waitTimeoutMs;
    }

    @Override
    public boolean tryLock(Long rideId, String ownerToken) {
        try {
            boolean locked = stripeOf(rideId).tryLock(waitTimeoutMs, TimeUnit.MILLISECONDS);
            log.debug("[LocalLock] Lock attempt: rideId={}, success={}", rideId, locked);
            return locked;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[LocalLock] Interrupted while waiting for lock: rideId={}", rideId);
            return false;
        }
    }

    @Override
    public void unlock(Long rideId, String ownerToken) {
        ReentrantLock lock = stripeOf(rideId);
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("[LocalLock] Lock released: rideId={}", rideId);
        } else {
            log.warn("[LocalLock] Unlock requested by non-owner thread: rideId={}", rideId);
        }
    }

    @Override
    public String getStrategyName() {
        return "local";
    }

    private ReentrantLock stripeOf(Long rideId) {
        return stripes[Math.floorMod(rideId.hashCode(), stripes.length)];
    }
}
