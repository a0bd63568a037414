package personal.hitch.coordination.escrow.adapter.out.external;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import personal.hitch.common.exception.UpstreamUnavailableException;
import personal.hitch.coordination.escrow.domain.exception.EscrowFundingDeclinedException;
import personal.hitch.coordination.escrow.domain.model.Escrow;
import personal.hitch.coordination.escrow.domain.model.EscrowStatus;
import personal.hitch.coordination.escrow.domain.model.EscrowSubjectType;

import java.math.BigDecimal;
import java.net.http.HttpClient;
import java.time.Duration;
import java.time.LocalDateTime;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PaymentProcessorRestClientAdapter 테스트 (WireMock)
 * 응답 코드별 예외 매핑과 Circuit Breaker 실패 집계 대상 검증
 */
@WireMockTest
@DisplayName("PaymentProcessor 어댑터 테스트 (WireMock)")
class PaymentProcessorRestClientAdapterTest {

    private static final String HOLD_PATH = "/api/v1/escrow-holds";

    private PaymentProcessorRestClientAdapter adapter;
    private final Escrow escrow = new Escrow(5L, 10L, new BigDecimal("42.50"), "USD", EscrowStatus.CREATED,
            EscrowSubjectType.PACKAGE, 7L, null, null, null, LocalDateTime.now(), LocalDateTime.now());

    @BeforeEach
    void setUp(WireMockRuntimeInfo wmRuntimeInfo) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(200))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(1000));

        RestClient restClient = RestClient.builder()
                .baseUrl(wmRuntimeInfo.getHttpBaseUrl())
                .requestFactory(requestFactory)
                .build();

        adapter = new PaymentProcessorRestClientAdapter(restClient);
    }

    @Test
    @DisplayName("승인 시 결제 대행사 참조를 반환하고 멱등 키를 전달한다")
    void hold_Approved() {
        // Given
        stubFor(post(urlEqualTo(HOLD_PATH))
                .willReturn(okJson("{\"reference\":\"hold-123\"}")));

        // When
        String reference = adapter.hold(escrow);

        // Then
        assertThat(reference).isEqualTo("hold-123");
        verify(postRequestedFor(urlEqualTo(HOLD_PATH))
                .withHeader("Idempotency-Key", equalTo("escrow-5"))
                .withRequestBody(matchingJsonPath("$.amount", equalTo("42.50")))
                .withRequestBody(matchingJsonPath("$.currency", equalTo("USD"))));
    }

    @Test
    @DisplayName("4xx 응답은 예치 거절로 변환된다")
    void hold_Declined() {
        // Given
        stubFor(post(urlEqualTo(HOLD_PATH)).willReturn(aResponse().withStatus(402)));

        // When & Then
        assertThatThrownBy(() -> adapter.hold(escrow))
                .isInstanceOf(EscrowFundingDeclinedException.class)
                .hasMessageContaining("escrowId=5")
                .hasMessageContaining("status 402");
    }

    @Test
    @DisplayName("5xx 응답은 외부 서비스 장애로 변환된다")
    void hold_ServerError() {
        // Given
        stubFor(post(urlEqualTo(HOLD_PATH)).willReturn(aResponse().withStatus(503)));

        // When & Then
        assertThatThrownBy(() -> adapter.hold(escrow))
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageContaining("payment-processor");
    }

    @Test
    @DisplayName("참조 없는 승인 응답은 외부 서비스 장애로 처리된다")
    void hold_MissingReference() {
        // Given
        stubFor(post(urlEqualTo(HOLD_PATH)).willReturn(okJson("{}")));

        // When & Then
        assertThatThrownBy(() -> adapter.hold(escrow))
                .isInstanceOf(UpstreamUnavailableException.class);
    }

    @Test
    @DisplayName("예치 거절은 Circuit 실패로 세지 않고, 장애 응답만 Circuit을 연다")
    void circuitBreaker_IgnoresDeclines() {
        // Given
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(4)
                .minimumNumberOfCalls(4)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(10))
                .ignoreExceptions(EscrowFundingDeclinedException.class)
                .build();
        CircuitBreaker circuitBreaker = CircuitBreakerRegistry.of(config).circuitBreaker("paymentProcessor");
        stubFor(post(urlEqualTo(HOLD_PATH)).willReturn(aResponse().withStatus(402)));

        // When: 거절 응답 반복
        for (int i = 0; i < 4; i++) {
            assertThatThrownBy(() -> circuitBreaker.executeSupplier(() -> adapter.hold(escrow)))
                    .isInstanceOf(EscrowFundingDeclinedException.class);
        }

        // Then
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getMetrics().getNumberOfFailedCalls()).isZero();

        // When: 장애 응답 반복
        stubFor(post(urlEqualTo(HOLD_PATH)).willReturn(aResponse().withStatus(500)));
        for (int i = 0; i < 4; i++) {
            assertThatThrownBy(() -> circuitBreaker.executeSupplier(() -> adapter.hold(escrow)))
                    .isInstanceOf(UpstreamUnavailableException.class);
        }

        // Then
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
    }
}
