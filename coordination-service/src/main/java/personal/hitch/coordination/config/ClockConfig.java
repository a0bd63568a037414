package personal.hitch.coordination.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 시간 소스 설정
 * 출발 시각, 자동 정산 유예 기간 등 시간 의존 로직은 이 Clock을 통해 현재 시각을 얻는다.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
