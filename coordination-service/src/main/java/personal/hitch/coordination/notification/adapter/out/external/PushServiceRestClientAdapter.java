package personal.hitch.coordination.notification.adapter.out.external;

import io.github.resilience4j.bulkhead.annotation.Bulkhead;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import personal.hitch.common.exception.UpstreamUnavailableException;
import personal.hitch.coordination.notification.application.port.out.PushNotificationPort;
import personal.hitch.coordination.notification.domain.model.Notification;
import personal.hitch.coordination.notification.domain.model.PushResult;

import java.util.Map;

/**
 * Push Service REST Client Adapter
 * 외부 푸시 서비스 호출 (RestClient 사용)
 *
 * - 2xx: DELIVERED
 * - 4xx: UNDELIVERABLE (등록된 기기 없음 등, Circuit 실패로 세지 않음)
 * - 5xx, Timeout: UpstreamUnavailableException
 *
 * 재시도는 푸시 서비스 정책이므로 @Retry를 두지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PushServiceRestClientAdapter implements PushNotificationPort {

    private static final String UPSTREAM = "push-service";

    @Qualifier("pushServiceRestClient")
    private final RestClient pushServiceRestClient;

    @Override
    @CircuitBreaker(name = "pushService", fallbackMethod = "pushFallback")
    @Bulkhead(name = "pushService", fallbackMethod = "pushFallback", type = Bulkhead.Type.SEMAPHORE)
    public PushResult push(Notification notification) {
        return pushServiceRestClient.post()
                .uri("/api/v1/push")
                .contentType(MediaType.APPLICATION_JSON)
                .body(new PushRequest(notification.userId(), notification.title(), notification.body(),
                        Map.of("notificationId", String.valueOf(notification.id()),
                                "type", notification.type().name())))
                .exchange((request, response) -> {
                    if (response.getStatusCode().is2xxSuccessful()) {
                        return PushResult.DELIVERED;
                    }
                    if (response.getStatusCode().is4xxClientError()) {
                        log.warn("Push rejected: userId={}, status={}",
                                notification.userId(), response.getStatusCode());
                        return PushResult.UNDELIVERABLE;
                    }
                    log.error("Push service unavailable: status={}", response.getStatusCode());
                    throw new UpstreamUnavailableException(UPSTREAM);
                });
    }

    /**
     * Circuit Open, Bulkhead Full, 네트워크 오류 시 호출
     */
    private PushResult pushFallback(Notification notification, Exception e) {
        log.error("Push service circuit breaker opened or bulkhead full: error={}", e.getClass().getSimpleName(), e);
        throw new UpstreamUnavailableException(UPSTREAM, e);
    }

    record PushRequest(Long userId, String title, String body, Map<String, String> data) {
    }
}
