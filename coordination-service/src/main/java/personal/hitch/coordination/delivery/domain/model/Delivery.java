package personal.hitch.coordination.delivery.domain.model;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;
import personal.hitch.coordination.delivery.domain.exception.DeliveryAccessDeniedException;
import personal.hitch.coordination.delivery.domain.exception.DeliveryAlreadyAssignedException;
import personal.hitch.coordination.delivery.domain.exception.DeliveryNotAcceptableException;

import java.time.LocalDateTime;

/**
 * Delivery Domain Model
 * 배송 요청 도메인 모델 (불변)
 * assignedCourierId는 한 번 설정되면 명시적 배정 취소로만 해제된다.
 */
public record Delivery(
        Long id,
        Long senderId,
        Long assignedCourierId,
        DeliveryStatus status,
        LocalDateTime acceptedAt,
        LocalDateTime createdAt) {

    public Delivery {
        if (senderId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Sender ID cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Delivery status cannot be null");
        }
        if (status == DeliveryStatus.OPEN && assignedCourierId != null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Open delivery cannot have a courier");
        }
    }

    public boolean isAssigned() {
        return assignedCourierId != null;
    }

    public boolean isAssignedTo(Long courierId) {
        return assignedCourierId != null && assignedCourierId.equals(courierId);
    }

    /**
     * 배송원 배정 (OPEN -> ASSIGNED)
     */
    public Delivery assignTo(Long courierId, LocalDateTime now) {
        ensureAcceptableBy(courierId);
        return new Delivery(id, senderId, courierId, DeliveryStatus.ASSIGNED, now, createdAt);
    }

    /**
     * 배정 취소 (ASSIGNED -> OPEN)
     */
    public Delivery unassign() {
        return new Delivery(id, senderId, null, DeliveryStatus.OPEN, null, createdAt);
    }

    // ========== Domain Validation Methods (Tell, Don't Ask) ==========

    /**
     * 수락 가능 여부 검증
     *
     * @throws DeliveryNotAcceptableException   본인 요청이거나 수락할 수 없는 상태
     * @throws DeliveryAlreadyAssignedException 이미 배정된 경우
     */
    public void ensureAcceptableBy(Long courierId) {
        if (senderId.equals(courierId)) {
            throw new DeliveryNotAcceptableException(id, "sender cannot deliver own package");
        }
        if (isAssigned()) {
            throw new DeliveryAlreadyAssignedException(id);
        }
        if (status != DeliveryStatus.OPEN) {
            throw new DeliveryNotAcceptableException(id, "delivery is " + status);
        }
    }

    /**
     * 배정 취소 가능 여부 검증 (배정된 배송원 본인, 픽업 전)
     */
    public void ensureUnassignableBy(Long courierId) {
        if (!isAssignedTo(courierId)) {
            throw new DeliveryAccessDeniedException(id, courierId);
        }
        if (status != DeliveryStatus.ASSIGNED) {
            throw new DeliveryNotAcceptableException(id, "assignment cannot be cancelled while " + status);
        }
    }
}
