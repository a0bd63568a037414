package personal.hitch.coordination.realtime.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;
import personal.hitch.coordination.booking.application.port.in.CancelBookingUseCase;
import personal.hitch.coordination.booking.application.port.in.ConfirmBookingUseCase;
import personal.hitch.coordination.delivery.application.port.in.AcceptDeliveryUseCase;
import personal.hitch.coordination.delivery.application.port.in.CancelDeliveryAssignmentUseCase;
import personal.hitch.coordination.escrow.application.port.in.EscrowTransitionUseCase;
import personal.hitch.coordination.presence.application.service.ConnectionRegistry;
import personal.hitch.coordination.presence.application.service.PresenceRegistry;
import personal.hitch.coordination.presence.domain.exception.AuthenticationFailedException;
import personal.hitch.coordination.presence.domain.exception.AuthenticationRequiredException;
import personal.hitch.coordination.realtime.application.port.out.RealtimeAuditPort;
import personal.hitch.coordination.realtime.domain.model.CallType;
import personal.hitch.coordination.realtime.domain.model.InboundMessage;
import personal.hitch.coordination.room.application.service.RoomBroadcastManager;
import personal.hitch.coordination.room.domain.model.RealtimeEvent;
import personal.hitch.coordination.room.domain.model.RoomId;
import personal.hitch.coordination.room.domain.model.RoomKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inbound Event Router
 * 실시간 연결로 들어온 이벤트를 Presence, Room, Call, Capacity, Escrow로 라우팅
 *
 * - authenticate, ping 외의 이벤트는 인증된 연결만 처리한다
 * - 비즈니스 실패는 보낸 연결에만 error 이벤트로 응답하고 다른 연결에는 영향을 주지 않는다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InboundEventRouter {

    static final String ERROR = "error";
    static final String AUTHENTICATED = "authenticated";
    static final String AUTHENTICATION_ERROR = "authentication_error";
    static final String LOCATION_UPDATED = "location_updated";
    static final String NEW_MESSAGE = "new_message";
    static final String STATUS_UPDATED = "status_updated";
    static final String GROUP_MESSAGE_READ = "group_message_read";
    private static final int MAX_MESSAGE_LENGTH = 1000;

    private final PresenceRegistry presenceRegistry;
    private final ConnectionRegistry connectionRegistry;
    private final RoomBroadcastManager roomBroadcastManager;
    private final LastKnownLocationCache lastKnownLocationCache;
    private final CallSignalingService callSignalingService;
    private final RealtimeAuditPort realtimeAuditPort;
    private final AcceptDeliveryUseCase acceptDeliveryUseCase;
    private final CancelDeliveryAssignmentUseCase cancelDeliveryAssignmentUseCase;
    private final ConfirmBookingUseCase confirmBookingUseCase;
    private final CancelBookingUseCase cancelBookingUseCase;
    private final EscrowTransitionUseCase escrowTransitionUseCase;

    public void route(String connectionId, InboundMessage message) {
        log.debug("Inbound event: connectionId={}, type={}", connectionId, message.type());
        try {
            switch (message.type()) {
                case "ping" -> reply(connectionId, RealtimeEvent.of("pong"));
                case "authenticate" -> authenticate(connectionId, message);
                default -> routeAuthenticated(connectionId, requireUser(connectionId), message);
            }
        } catch (BusinessException e) {
            log.warn("Inbound event rejected: connectionId={}, type={}, code={}, reason={}",
                    connectionId, message.type(), e.getErrorCode(), e.getMessage());
            reply(connectionId, errorEvent(e.getErrorCode(), e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Inbound event failed: connectionId={}, type={}", connectionId, message.type(), e);
            reply(connectionId, errorEvent(ErrorCode.INTERNAL_SERVER_ERROR,
                    ErrorCode.INTERNAL_SERVER_ERROR.getMessage()));
        }
    }

    /**
     * 해석할 수 없는 프레임에 대한 error 응답
     */
    public void reject(String connectionId, BusinessException e) {
        reply(connectionId, errorEvent(e.getErrorCode(), e.getMessage()));
    }

    /**
     * 인증 실패 시 authentication_error 응답 후 연결 종료
     */
    public void authenticate(String connectionId, String credential) {
        try {
            Long userId = presenceRegistry.authenticate(connectionId, credential);
            reply(connectionId, RealtimeEvent.of(AUTHENTICATED, Map.of("userId", userId)));
        } catch (AuthenticationFailedException e) {
            log.warn("Authentication failed: connectionId={}, reason={}", connectionId, e.getMessage());
            reply(connectionId, RealtimeEvent.of(AUTHENTICATION_ERROR, Map.of(
                    "code", e.getErrorCode().name(),
                    "message", e.getErrorCode().getMessage())));
            connectionRegistry.close(connectionId, "authentication failed");
        }
    }

    /**
     * 연결 종료 직전 호출 (Presence 정리 전)
     * 진행 중인 통화를 종료하고 상대에게 알린다.
     */
    public void disconnected(String connectionId) {
        presenceRegistry.userOf(connectionId).ifPresent(userId -> {
            try {
                callSignalingService.disconnected(connectionId, userId);
            } catch (RuntimeException e) {
                log.error("Failed to end calls of closed connection: connectionId={}, userId={}",
                        connectionId, userId, e);
            }
        });
    }

    private void authenticate(String connectionId, InboundMessage message) {
        authenticate(connectionId, message.optionalText("credential").orElse(null));
    }

    private void routeAuthenticated(String connectionId, Long userId, InboundMessage message) {
        switch (message.type()) {
            case "join_ride" -> join(connectionId, new RoomId(RoomKind.RIDE, message.requireLong("entityId")));
            case "join_package" -> join(connectionId, new RoomId(RoomKind.PACKAGE, message.requireLong("entityId")));
            case "join_group" -> join(connectionId, new RoomId(RoomKind.GROUP, message.requireLong("entityId")));
            case "leave_ride" -> leave(connectionId, new RoomId(RoomKind.RIDE, message.requireLong("entityId")));
            case "leave_package" -> leave(connectionId, new RoomId(RoomKind.PACKAGE, message.requireLong("entityId")));
            case "leave_group" -> leave(connectionId, new RoomId(RoomKind.GROUP, message.requireLong("entityId")));
            case "location_update" -> updateLocation(userId, message);
            case "send_message" -> sendMessage(connectionId, userId, message);
            case "typing_start" -> typing(connectionId, userId, message, true);
            case "typing_stop" -> typing(connectionId, userId, message, false);
            case "update_status" -> updateStatus(connectionId, userId, message);
            case "get_online_users" -> onlineUsers(connectionId, message);
            case "group_message_read" -> markGroupRead(connectionId, userId, message);
            case "call_initiate" -> callSignalingService.initiate(connectionId, userId,
                    message.requireLong("to"), callTypeOf(message));
            case "call_accept" -> callSignalingService.accept(userId, message.requireLong("callId"));
            case "call_reject" -> callSignalingService.reject(userId, message.requireLong("callId"),
                    message.optionalText("reason").orElse(null));
            case "call_end" -> callSignalingService.end(userId, message.requireLong("callId"),
                    message.optionalText("reason").orElse(null));
            case "call_signal" -> callSignalingService.signal(connectionId, userId, message.requireLong("callId"),
                    message.requireText("signalType"), message.payload().get("data"));
            case "join_call" -> callSignalingService.join(connectionId, userId, message.requireLong("callId"));
            case "leave_call" -> callSignalingService.leave(connectionId, message.requireLong("callId"));
            default -> throw new BusinessException(ErrorCode.UNKNOWN_EVENT, "Unknown event: " + message.type());
        }
    }

    private Long requireUser(String connectionId) {
        return presenceRegistry.userOf(connectionId)
                .orElseThrow(() -> new AuthenticationRequiredException(connectionId));
    }

    // ========== Room ==========

    private void join(String connectionId, RoomId roomId) {
        roomBroadcastManager.join(connectionId, roomId);
        reply(connectionId, RealtimeEvent.of("joined", Map.of("room", roomId.toString())));
        lastKnownLocationCache.lastOf(roomId).ifPresent(location -> reply(connectionId, location));
    }

    private void leave(String connectionId, RoomId roomId) {
        roomBroadcastManager.leave(connectionId, roomId);
        reply(connectionId, RealtimeEvent.of("left", Map.of("room", roomId.toString())));
    }

    private void onlineUsers(String connectionId, InboundMessage message) {
        RoomId roomId = roomOf(message, "entityId", RoomKind.RIDE);
        reply(connectionId, RealtimeEvent.of("online_users", Map.of(
                "room", roomId.toString(),
                "userIds", List.copyOf(roomBroadcastManager.memberUserIds(roomId)))));
    }

    // ========== Location / Chat ==========

    /**
     * 위치 갱신: rideId, packageId 중 지정된 Room 모두에 전파
     */
    private void updateLocation(Long userId, InboundMessage message) {
        double lat = message.requireDouble("lat");
        double lng = message.requireDouble("lng");
        if (!isWithin(lat, 90) || !isWithin(lng, 180)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Coordinates out of range");
        }

        List<RoomId> targets = new ArrayList<>();
        message.optionalLong("rideId").ifPresent(rideId -> targets.add(RoomId.ride(rideId)));
        message.optionalLong("packageId").ifPresent(packageId -> targets.add(RoomId.pkg(packageId)));
        if (targets.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "rideId or packageId is required");
        }

        for (RoomId roomId : targets) {
            Map<String, Object> location = new LinkedHashMap<>();
            location.put("room", roomId.toString());
            location.put("userId", userId);
            location.put("lat", lat);
            location.put("lng", lng);
            message.optionalDouble("speed").ifPresent(speed -> location.put("speed", speed));
            message.optionalDouble("heading").ifPresent(heading -> location.put("heading", heading));

            RealtimeEvent event = RealtimeEvent.of(LOCATION_UPDATED, location);
            rememberIfRoomExists(roomId, event);
            roomBroadcastManager.broadcast(roomId, event);
            realtimeAuditPort.recordLocation(roomId, userId, location);
        }
    }

    private static boolean isWithin(double coordinate, double bound) {
        return Double.isFinite(coordinate) && coordinate >= -bound && coordinate <= bound;
    }

    private void rememberIfRoomExists(RoomId roomId, RealtimeEvent event) {
        if (!roomBroadcastManager.exists(roomId)) {
            return;
        }
        lastKnownLocationCache.remember(roomId, event);
        // 저장 직후 Room이 사라졌으면 캐시에 남기지 않는다
        if (!roomBroadcastManager.exists(roomId)) {
            lastKnownLocationCache.forget(roomId);
        }
    }

    /**
     * 채팅: 해당 Room에 가입한 연결만 보낼 수 있다
     */
    private void sendMessage(String connectionId, Long userId, InboundMessage message) {
        RoomId roomId = roomOf(message, "targetId", RoomKind.RIDE);
        String text = message.requireText("text");
        if (text.length() > MAX_MESSAGE_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Message is too long");
        }
        requireMembership(connectionId, roomId);

        RealtimeEvent event = RealtimeEvent.of(NEW_MESSAGE, Map.of(
                "room", roomId.toString(),
                "senderId", userId,
                "text", text));
        roomBroadcastManager.broadcast(roomId, event);
        realtimeAuditPort.recordMessage(roomId, userId, text);
    }

    private void typing(String connectionId, Long userId, InboundMessage message, boolean typing) {
        RoomId roomId = roomOf(message, "entityId", RoomKind.RIDE);
        requireMembership(connectionId, roomId);
        roomBroadcastManager.broadcastExcept(roomId, RealtimeEvent.of("user_typing", Map.of(
                "room", roomId.toString(),
                "userId", userId,
                "isTyping", typing)), connectionId);
    }

    /**
     * 그룹 채팅 읽음 표시: 발신자를 제외한 그룹 멤버에게 전달
     */
    private void markGroupRead(String connectionId, Long userId, InboundMessage message) {
        RoomId roomId = RoomId.group(message.requireLong("entityId"));
        requireMembership(connectionId, roomId);

        Map<String, Object> receipt = new LinkedHashMap<>();
        receipt.put("room", roomId.toString());
        receipt.put("groupId", roomId.entityId());
        receipt.put("userId", userId);
        message.optionalLong("messageId").ifPresent(messageId -> receipt.put("messageId", messageId));
        roomBroadcastManager.broadcastExcept(roomId, RealtimeEvent.of(GROUP_MESSAGE_READ, receipt), connectionId);
    }

    // ========== Status ==========

    /**
     * 상태 변경 요청
     * Capacity/Escrow 전이가 정의된 상태는 해당 Use Case를 호출하고 (결과 전파는 Use Case가 수행),
     * 나머지는 status_updated로 Room에 그대로 전파한다.
     */
    private void updateStatus(String connectionId, Long userId, InboundMessage message) {
        Long entityId = message.requireLong("entityId");
        String status = message.requireText("status").toLowerCase();
        String kind = message.optionalText("kind").orElse(RoomKind.PACKAGE.getPrefix()).toLowerCase();

        switch (kind) {
            case "package" -> updatePackageStatus(entityId, userId, status);
            case "booking" -> updateBookingStatus(entityId, userId, status);
            case "escrow" -> updateEscrowStatus(entityId, userId, status, message);
            case "ride", "group" -> {
                RoomId roomId = new RoomId(RoomKind.fromPrefix(kind).orElseThrow(), entityId);
                broadcastStatus(roomId, userId, status);
            }
            default -> throw new BusinessException(ErrorCode.INVALID_INPUT, "Unknown status kind: " + kind);
        }
        reply(connectionId, RealtimeEvent.of("status_ack", Map.of(
                "kind", kind,
                "entityId", entityId,
                "status", status)));
    }

    private void updatePackageStatus(Long deliveryId, Long userId, String status) {
        switch (status) {
            case "accepted" -> acceptDeliveryUseCase.accept(deliveryId, userId);
            case "assignment_cancelled" -> cancelDeliveryAssignmentUseCase.cancelAssignment(deliveryId, userId);
            default -> broadcastStatus(RoomId.pkg(deliveryId), userId, status);
        }
    }

    private void updateBookingStatus(Long bookingId, Long userId, String status) {
        switch (status) {
            case "confirmed" -> confirmBookingUseCase.confirm(bookingId, userId);
            case "cancelled" -> cancelBookingUseCase.cancel(bookingId, userId);
            default -> throw new BusinessException(ErrorCode.INVALID_INPUT, "Unsupported booking status: " + status);
        }
    }

    private void updateEscrowStatus(Long escrowId, Long userId, String status, InboundMessage message) {
        switch (status) {
            case "released" -> escrowTransitionUseCase.release(escrowId, userId);
            case "refunded" -> escrowTransitionUseCase.refund(escrowId, userId);
            case "disputed" -> escrowTransitionUseCase.dispute(escrowId, userId, message.requireText("reason"));
            default -> throw new BusinessException(ErrorCode.INVALID_INPUT, "Unsupported escrow status: " + status);
        }
    }

    private void broadcastStatus(RoomId roomId, Long userId, String status) {
        roomBroadcastManager.broadcast(roomId, RealtimeEvent.of(STATUS_UPDATED, Map.of(
                "room", roomId.toString(),
                "userId", userId,
                "status", status)));
    }

    // ========== Helpers ==========

    private RoomId roomOf(InboundMessage message, String idField, RoomKind defaultKind) {
        RoomKind kind = message.optionalText("targetKind")
                .or(() -> message.optionalText("kind"))
                .map(prefix -> RoomKind.fromPrefix(prefix)
                        .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_INPUT, "Unknown room kind: " + prefix)))
                .orElse(defaultKind);
        return new RoomId(kind, message.requireLong(idField));
    }

    private CallType callTypeOf(InboundMessage message) {
        String wireName = message.optionalText("callType").orElse(CallType.VOICE.getWireName());
        return CallType.fromWireName(wireName)
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_INPUT, "Unknown call type: " + wireName));
    }

    private void requireMembership(String connectionId, RoomId roomId) {
        if (!roomBroadcastManager.roomsOf(connectionId).contains(roomId)) {
            throw new BusinessException(ErrorCode.FORBIDDEN, "Not a member of room " + roomId);
        }
    }

    private void reply(String connectionId, RealtimeEvent event) {
        roomBroadcastManager.sendTo(connectionId, event);
    }

    private RealtimeEvent errorEvent(ErrorCode errorCode, String message) {
        return RealtimeEvent.of(ERROR, Map.of(
                "code", errorCode.name(),
                "message", message == null ? errorCode.getMessage() : message));
    }
}
