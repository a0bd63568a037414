package personal.hitch.coordination.notification.domain.model;

/**
 * 알림 종류
 */
public enum NotificationType {
    BOOKING_CREATED,
    BOOKING_CONFIRMED,
    BOOKING_CANCELLED,
    DELIVERY_ACCEPTED,
    DELIVERY_ASSIGNMENT_CANCELLED,
    ESCROW_FUNDED,
    ESCROW_RELEASED,
    ESCROW_REFUNDED,
    ESCROW_DISPUTED
}
