package personal.hitch.coordination;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Coordination Service Application
 * Presence, Room, Capacity, Escrow, Notification을 포함하는 실시간 조정 서비스
 */
@EnableScheduling  // Outbox / Escrow Auto-Release Scheduler 활성화
@ConfigurationPropertiesScan
@SpringBootApplication(
    scanBasePackages = {
        "personal.hitch.coordination",
        "personal.hitch.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class CoordinationServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(CoordinationServiceApplication.class, args);
    }
}
