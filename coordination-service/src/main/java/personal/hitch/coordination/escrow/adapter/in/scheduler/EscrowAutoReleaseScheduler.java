package personal.hitch.coordination.escrow.adapter.in.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.hitch.coordination.escrow.application.port.in.AutoReleaseEscrowsUseCase;

/**
 * Escrow Auto Release Scheduler
 * 유예 기간이 지난 FUNDED 에스크로를 주기적으로 정산
 * escrow.auto-release.sweep-enabled=true 일 때만 등록된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "escrow.auto-release.sweep-enabled", havingValue = "true")
public class EscrowAutoReleaseScheduler {

    private final AutoReleaseEscrowsUseCase autoReleaseEscrowsUseCase;

    @Scheduled(fixedDelayString = "${escrow.auto-release.sweep-interval-ms:60000}")
    public void sweep() {
        int released = autoReleaseEscrowsUseCase.releaseEligible();
        if (released > 0) {
            log.info("Auto-released escrows: count={}", released);
        }
    }
}
