package personal.hitch.coordination.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * RestClient Configuration
 * 외부 협력 서비스별 RestClient 설정
 *
 * Timeout 전략:
 * - Connect Timeout: TCP 연결 실패 빠른 감지
 * - Read Timeout: Circuit Breaker Slow Call 기준과 일치
 */
@Configuration
public class RestClientConfig {

    @Value("${external.auth-service.base-url}")
    private String authServiceBaseUrl;

    @Value("${external.payment-processor.base-url}")
    private String paymentProcessorBaseUrl;

    @Value("${external.push-service.base-url}")
    private String pushServiceBaseUrl;

    @Value("${external.connect-timeout-ms:200}")
    private int connectTimeoutMs;

    @Value("${external.read-timeout-ms:1000}")
    private int readTimeoutMs;

    // 결제 대행사는 예치 승인에 시간이 더 걸린다
    @Value("${external.payment-processor.read-timeout-ms:3000}")
    private int paymentReadTimeoutMs;

    @Bean
    public RestClient authServiceRestClient() {
        return buildRestClient(authServiceBaseUrl, readTimeoutMs);
    }

    @Bean
    public RestClient paymentProcessorRestClient() {
        return buildRestClient(paymentProcessorBaseUrl, paymentReadTimeoutMs);
    }

    @Bean
    public RestClient pushServiceRestClient() {
        return buildRestClient(pushServiceBaseUrl, readTimeoutMs);
    }

    private RestClient buildRestClient(String baseUrl, int readTimeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeout));

        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
    }
}
