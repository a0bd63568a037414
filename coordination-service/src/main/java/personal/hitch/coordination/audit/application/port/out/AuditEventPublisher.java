package personal.hitch.coordination.audit.application.port.out;

/**
 * 감사 이벤트 발행 Port (메시지 브로커)
 */
public interface AuditEventPublisher {

    /**
     * 직렬화된 payload를 그대로 발행
     * 브로커가 수신을 확인하지 못하면 예외를 던진다.
     */
    void publishRaw(String topic, String key, String payload);
}
