package personal.hitch.coordination.presence.adapter.out.external;

import io.github.resilience4j.bulkhead.annotation.Bulkhead;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import personal.hitch.common.exception.UpstreamUnavailableException;
import personal.hitch.coordination.presence.application.port.out.CredentialVerifier;
import personal.hitch.coordination.presence.domain.exception.AuthenticationFailedException;

import java.util.Map;

/**
 * Auth Service REST Client Adapter
 * 외부 인증 서비스와 HTTP 통신하는 구현체 (RestClient 사용)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthServiceRestClientAdapter implements CredentialVerifier {

    private static final String UPSTREAM = "auth-service";

    @Qualifier("authServiceRestClient")
    private final RestClient authServiceRestClient;

    /**
     * 자격 증명 검증
     * - 4xx: AuthenticationFailedException (Circuit 실패로 세지 않음)
     * - 5xx, Timeout: UpstreamUnavailableException (Circuit 실패로 카운트)
     */
    @Override
    @CircuitBreaker(name = "authService", fallbackMethod = "verifyFallback")
    @Bulkhead(name = "authService", fallbackMethod = "verifyFallback", type = Bulkhead.Type.SEMAPHORE)
    @Retry(name = "authService")
    public Long verify(String credential) {
        VerifyResponse response = authServiceRestClient.post()
                .uri("/api/v1/auth/verify")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("token", credential))
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (request, res) -> {
                    log.warn("Credential rejected by auth service: status={}", res.getStatusCode());
                    throw new AuthenticationFailedException("credential rejected");
                })
                .onStatus(HttpStatusCode::is5xxServerError, (request, res) -> {
                    log.error("Auth service unavailable: status={}", res.getStatusCode());
                    throw new UpstreamUnavailableException(UPSTREAM);
                })
                .body(VerifyResponse.class);

        if (response == null || response.userId() == null) {
            throw new AuthenticationFailedException("auth service returned no user");
        }
        log.debug("Credential verified: userId={}", response.userId());
        return response.userId();
    }

    /**
     * 인증 거부는 그대로 전달
     */
    private Long verifyFallback(String credential, AuthenticationFailedException e) {
        throw e;
    }

    /**
     * Circuit Open, Bulkhead Full, 네트워크 오류 시 호출
     */
    private Long verifyFallback(String credential, Exception e) {
        log.error("Auth service circuit breaker opened or bulkhead full: error={}", e.getClass().getSimpleName(), e);
        throw new UpstreamUnavailableException(UPSTREAM, e);
    }

    record VerifyResponse(Long userId) {
    }
}
