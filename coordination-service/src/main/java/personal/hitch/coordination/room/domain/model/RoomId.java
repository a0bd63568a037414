package personal.hitch.coordination.room.domain.model;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

/**
 * Room 식별자
 * 하나의 운행/배송/그룹 채팅/통화에 대한 구독 범위 (예: ride:42)
 */
public record RoomId(RoomKind kind, Long entityId) {

    public RoomId {
        if (kind == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Room kind cannot be null");
        }
        if (entityId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Room entity ID cannot be null");
        }
    }

    public static RoomId ride(Long rideId) {
        return new RoomId(RoomKind.RIDE, rideId);
    }

    public static RoomId pkg(Long deliveryId) {
        return new RoomId(RoomKind.PACKAGE, deliveryId);
    }

    public static RoomId group(Long groupId) {
        return new RoomId(RoomKind.GROUP, groupId);
    }

    public static RoomId call(Long callId) {
        return new RoomId(RoomKind.CALL, callId);
    }

    @Override
    public String toString() {
        return kind.getPrefix() + ":" + entityId;
    }
}
