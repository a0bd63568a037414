package personal.hitch.coordination.audit.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Outbox 중계 Properties
 *
 * 설정 예시:
 * outbox:
 *   publisher:
 *     enabled: true
 *     interval-ms: 500
 *     batch-size: 100
 *     max-retries: 3
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "outbox.publisher")
public class OutboxPublisherProperties {

    private boolean enabled = true;

    private long intervalMs = 500;

    /**
     * 한 번의 중계에서 읽는 최대 이벤트 수
     */
    private int batchSize = 100;

    /**
     * 이 횟수만큼 실패하면 FAILED로 격리
     */
    private int maxRetries = 3;
}
