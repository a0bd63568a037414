package personal.hitch.coordination.escrow.application.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 에스크로 자동 정산 정책 Properties
 *
 * 설정 예시:
 * escrow:
 *   auto-release:
 *     grace-period: 24h
 *     sweep-enabled: false
 *     sweep-interval-ms: 60000
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "escrow.auto-release")
public class EscrowAutoReleaseProperties {

    /**
     * FUNDED 이후 분쟁 없이 유지되어야 하는 기간
     */
    private Duration gracePeriod = Duration.ofHours(24);

    /**
     * 주기적 자동 정산 여부 (기본: 꺼짐, 정산은 명시적 release 호출)
     */
    private boolean sweepEnabled = false;

    private long sweepIntervalMs = 60_000;

    private int sweepBatchSize = 100;
}
