package personal.hitch.coordination.audit.application.port.in;

/**
 * 대기 중인 Outbox 이벤트 발행 Use Case
 */
public interface PublishPendingEventsUseCase {

    /**
     * @return 발행에 성공한 이벤트 수
     */
    int publishPendingEvents();
}
