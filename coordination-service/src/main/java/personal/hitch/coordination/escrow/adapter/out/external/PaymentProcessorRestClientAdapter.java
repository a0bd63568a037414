package personal.hitch.coordination.escrow.adapter.out.external;

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
import personal.hitch.coordination.escrow.application.port.out.PaymentProcessorPort;
import personal.hitch.coordination.escrow.domain.exception.EscrowFundingDeclinedException;
import personal.hitch.coordination.escrow.domain.model.Escrow;

/**
 * Payment Processor REST Client Adapter
 * 외부 결제 대행사 예치 API 호출 (RestClient 사용)
 *
 * Idempotency-Key는 에스크로 ID 기반이므로 재시도해도 중복 예치되지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentProcessorRestClientAdapter implements PaymentProcessorPort {

    private static final String UPSTREAM = "payment-processor";

    @Qualifier("paymentProcessorRestClient")
    private final RestClient paymentProcessorRestClient;

    /**
     * 예치 요청
     * - 4xx: EscrowFundingDeclinedException (Circuit 실패로 세지 않음)
     * - 5xx, Timeout: UpstreamUnavailableException
     */
    @Override
    @CircuitBreaker(name = "paymentProcessor", fallbackMethod = "holdFallback")
    @Bulkhead(name = "paymentProcessor", fallbackMethod = "holdFallback", type = Bulkhead.Type.SEMAPHORE)
    @Retry(name = "paymentProcessor")
    public String hold(Escrow escrow) {
        HoldResponse response = paymentProcessorRestClient.post()
                .uri("/api/v1/escrow-holds")
                .contentType(MediaType.APPLICATION_JSON)
                .header("Idempotency-Key", "escrow-" + escrow.id())
                .body(new HoldRequest(escrow.id(), escrow.payerId(), escrow.amount().toPlainString(),
                        escrow.currency()))
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (request, res) -> {
                    log.warn("Payment processor declined hold: escrowId={}, status={}",
                            escrow.id(), res.getStatusCode());
                    throw new EscrowFundingDeclinedException(escrow.id(), "status " + res.getStatusCode().value());
                })
                .onStatus(HttpStatusCode::is5xxServerError, (request, res) -> {
                    log.error("Payment processor unavailable: escrowId={}, status={}",
                            escrow.id(), res.getStatusCode());
                    throw new UpstreamUnavailableException(UPSTREAM);
                })
                .body(HoldResponse.class);

        if (response == null || response.reference() == null) {
            throw new UpstreamUnavailableException(UPSTREAM);
        }
        return response.reference();
    }

    /**
     * 거절은 그대로 전달 (상태는 CREATED 유지)
     */
    private String holdFallback(Escrow escrow, EscrowFundingDeclinedException e) {
        throw e;
    }

    /**
     * Circuit Open, Bulkhead Full, 네트워크 오류 시 호출
     */
    private String holdFallback(Escrow escrow, Exception e) {
        log.error("Payment processor circuit breaker opened or bulkhead full: escrowId={}, error={}",
                escrow.id(), e.getClass().getSimpleName(), e);
        throw new UpstreamUnavailableException(UPSTREAM, e);
    }

    record HoldRequest(Long escrowId, Long payerId, String amount, String currency) {
    }

    record HoldResponse(String reference) {
    }
}
