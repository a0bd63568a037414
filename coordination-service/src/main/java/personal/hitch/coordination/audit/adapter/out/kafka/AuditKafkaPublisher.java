package personal.hitch.coordination.audit.adapter.out.kafka;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import personal.hitch.coordination.audit.application.port.out.AuditEventPublisher;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Audit Kafka Publisher (Adapter Layer)
 * Kafka를 통한 감사 이벤트 발행 구현체
 * Outbox Service에 의해 호출되며, 브로커 확인(ack)을 받은 뒤에만 발행 완료로 처리된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditKafkaPublisher implements AuditEventPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 5;

    private final KafkaTemplate<String, String> kafkaTemplate;

    @Override
    public void publishRaw(String topic, String key, String payload) {
        log.debug("Publishing raw event: topic={}, key={}", topic, key);
        try {
            kafkaTemplate.send(topic, key, payload).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.debug("Raw event published: topic={}, key={}", topic, key);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while publishing to " + topic, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Kafka publish failed: topic=" + topic + ", key=" + key, e);
        }
    }
}
