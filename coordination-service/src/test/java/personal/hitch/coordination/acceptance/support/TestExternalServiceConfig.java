package personal.hitch.coordination.acceptance.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import personal.hitch.coordination.escrow.application.port.out.PaymentProcessorPort;
import personal.hitch.coordination.escrow.domain.exception.EscrowFundingDeclinedException;
import personal.hitch.coordination.notification.application.port.out.PushNotificationPort;
import personal.hitch.coordination.notification.domain.model.PushResult;
import personal.hitch.coordination.presence.application.port.out.CredentialVerifier;
import personal.hitch.coordination.presence.domain.exception.AuthenticationFailedException;

import java.math.BigDecimal;

/**
 * Test용 외부 서비스 스텁 설정
 * 실제 인증 서비스, 결제 대행사, 푸시 서비스 호출 없이 테스트 가능하도록 함
 */
@TestConfiguration
@Profile("test")
public class TestExternalServiceConfig {

    /** 이 금액 이상은 결제 대행사가 거절 */
    public static final BigDecimal DECLINE_THRESHOLD = new BigDecimal("100000");

    @Bean
    @Primary
    public CredentialVerifier stubCredentialVerifier() {
        // "token-{userId}" 형식만 유효
        return credential -> {
            if (credential == null || !credential.startsWith("token-")) {
                throw new AuthenticationFailedException("credential rejected");
            }
            return Long.valueOf(credential.substring("token-".length()));
        };
    }

    @Bean
    @Primary
    public PaymentProcessorPort stubPaymentProcessor() {
        return escrow -> {
            if (escrow.amount().compareTo(DECLINE_THRESHOLD) >= 0) {
                throw new EscrowFundingDeclinedException(escrow.id(), "limit exceeded");
            }
            return "PAY-" + escrow.id();
        };
    }

    @Bean
    @Primary
    public PushNotificationPort stubPushNotification() {
        return notification -> PushResult.DELIVERED;
    }
}
