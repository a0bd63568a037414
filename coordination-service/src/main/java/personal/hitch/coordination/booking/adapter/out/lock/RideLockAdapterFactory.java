package personal.hitch.coordination.booking.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import personal.hitch.coordination.booking.application.port.out.RideLockPort;

import java.time.Duration;

/**
 * Ride Lock Adapter Factory
 * 설정에 따라 적절한 RideLockPort 구현체를 생성
 *
 * 설정:
 * - capacity.lock.strategy=local → LocalRideLockAdapter (기본값)
 * - capacity.lock.strategy=redis → RedisRideLockAdapter (다중 인스턴스)
 */
@Slf4j
@Configuration
public class RideLockAdapterFactory {

    @Bean
    @ConditionalOnProperty(name = "capacity.lock.strategy", havingValue = "local", matchIfMissing = true)
    public RideLockPort localRideLockAdapter(RideLockProperties properties) {
        log.info("Creating LocalRideLockAdapter - stripes: {}, wait: {}ms",
                properties.getStripes(), properties.getWaitTimeoutMs());
        return new LocalRideLockAdapter(properties.getStripes(), properties.getWaitTimeoutMs());
    }

    @Bean
    @ConditionalOnProperty(name = "capacity.lock.strategy", havingValue = "redis")
    public RideLockPort redisRideLockAdapter(StringRedisTemplate redisTemplate, RideLockProperties properties) {
        log.info("Creating RedisRideLockAdapter - TTL: {}s, wait: {}ms",
                properties.getTtlSeconds(), properties.getWaitTimeoutMs());
        return new RedisRideLockAdapter(
                redisTemplate,
                Duration.ofSeconds(properties.getTtlSeconds()),
                properties.getWaitTimeoutMs());
    }
}
