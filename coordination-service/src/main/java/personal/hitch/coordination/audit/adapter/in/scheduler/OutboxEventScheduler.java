package personal.hitch.coordination.audit.adapter.in.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.hitch.coordination.audit.application.port.in.PublishPendingEventsUseCase;

/**
 * Outbox 중계 Scheduler (Driving Adapter)
 * 직전 중계가 끝난 뒤 interval-ms 만큼 쉬고 다시 실행
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class OutboxEventScheduler {

    private final PublishPendingEventsUseCase publishPendingEventsUseCase;

    @Scheduled(fixedDelayString = "${outbox.publisher.interval-ms:500}",
            initialDelayString = "${outbox.publisher.interval-ms:500}")
    public void relayAuditEvents() {
        long startedAt = System.currentTimeMillis();
        int relayed = publishPendingEventsUseCase.publishPendingEvents();
        if (relayed > 0) {
            log.debug("Audit events relayed: count={}, elapsedMs={}", relayed, System.currentTimeMillis() - startedAt);
        }
    }
}
