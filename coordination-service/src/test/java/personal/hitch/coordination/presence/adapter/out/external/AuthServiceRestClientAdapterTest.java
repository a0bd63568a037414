package personal.hitch.coordination.presence.adapter.out.external;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import personal.hitch.common.exception.UpstreamUnavailableException;
import personal.hitch.coordination.presence.domain.exception.AuthenticationFailedException;

import java.net.http.HttpClient;
import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AuthServiceRestClientAdapter 테스트 (WireMock)
 */
@WireMockTest
@DisplayName("AuthService 어댑터 테스트 (WireMock)")
class AuthServiceRestClientAdapterTest {

    private static final String VERIFY_PATH = "/api/v1/auth/verify";

    private AuthServiceRestClientAdapter adapter;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wmRuntimeInfo) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(200))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(500));

        RestClient restClient = RestClient.builder()
                .baseUrl(wmRuntimeInfo.getHttpBaseUrl())
                .requestFactory(requestFactory)
                .build();

        adapter = new AuthServiceRestClientAdapter(restClient);
    }

    @Test
    @DisplayName("유효한 자격 증명은 사용자 ID로 검증된다")
    void verify_Success() {
        // Given
        stubFor(post(urlEqualTo(VERIFY_PATH))
                .withRequestBody(matchingJsonPath("$.token", equalTo("token-abc")))
                .willReturn(okJson("{\"userId\":100}")));

        // When
        Long userId = adapter.verify("token-abc");

        // Then
        assertThat(userId).isEqualTo(100L);
    }

    @Test
    @DisplayName("401 응답은 인증 실패로 변환된다")
    void verify_Rejected() {
        // Given
        stubFor(post(urlEqualTo(VERIFY_PATH)).willReturn(aResponse().withStatus(401)));

        // When & Then
        assertThatThrownBy(() -> adapter.verify("expired"))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessageContaining("credential rejected");
    }

    @Test
    @DisplayName("5xx 응답은 외부 서비스 장애로 변환된다")
    void verify_ServerError() {
        // Given
        stubFor(post(urlEqualTo(VERIFY_PATH)).willReturn(aResponse().withStatus(502)));

        // When & Then
        assertThatThrownBy(() -> adapter.verify("token-abc"))
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageContaining("auth-service");
    }

    @Test
    @DisplayName("사용자 ID가 없는 응답은 인증 실패로 처리된다")
    void verify_NoUser() {
        // Given
        stubFor(post(urlEqualTo(VERIFY_PATH)).willReturn(okJson("{}")));

        // When & Then
        assertThatThrownBy(() -> adapter.verify("token-abc"))
                .isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    @DisplayName("Read Timeout은 재시도 대상인 ResourceAccessException으로 전달된다")
    void verify_Timeout() {
        // Given
        stubFor(post(urlEqualTo(VERIFY_PATH))
                .willReturn(okJson("{\"userId\":100}").withFixedDelay(1500)));

        // When & Then
        assertThatThrownBy(() -> adapter.verify("token-abc"))
                .isInstanceOf(ResourceAccessException.class);
    }
}
