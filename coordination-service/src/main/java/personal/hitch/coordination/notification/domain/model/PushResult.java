package personal.hitch.coordination.notification.domain.model;

/**
 * 푸시 전달 결과
 */
public enum PushResult {
    DELIVERED,
    UNDELIVERABLE
}
