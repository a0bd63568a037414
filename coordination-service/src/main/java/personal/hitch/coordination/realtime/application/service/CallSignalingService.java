package personal.hitch.coordination.realtime.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;
import personal.hitch.coordination.presence.application.service.PresenceRegistry;
import personal.hitch.coordination.realtime.domain.exception.CalleeOfflineException;
import personal.hitch.coordination.realtime.domain.model.CallSession;
import personal.hitch.coordination.realtime.domain.model.CallType;
import personal.hitch.coordination.room.application.service.RoomBroadcastManager;
import personal.hitch.coordination.room.domain.model.RealtimeEvent;
import personal.hitch.coordination.room.domain.model.RoomId;
import personal.hitch.coordination.room.domain.model.RoomKind;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Call Signaling Service
 * 1:1 통화의 호출/수락/거절/종료와 WebRTC 시그널 중계
 *
 * - 두 참가자의 연결은 call:{id} Room에 가입하며, 모든 통화 이벤트는 이 Room으로 전파된다
 * - 거절/종료/연결 끊김 시 Room의 모든 연결을 내보내고 세션을 제거한다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CallSignalingService {

    static final String INCOMING_CALL = "incoming_call";
    static final String CALL_INITIATED = "call_initiated";
    static final String CALL_ACCEPTED = "call_accepted";
    static final String CALL_REJECTED = "call_rejected";
    static final String CALL_ENDED = "call_ended";
    static final String CALL_SIGNAL = "call_signal";
    static final String PARTICIPANT_DISCONNECTED = "call_participant_disconnected";
    static final Set<String> SIGNAL_TYPES = Set.of("offer", "answer", "ice-candidate");

    private final PresenceRegistry presenceRegistry;
    private final RoomBroadcastManager roomBroadcastManager;
    private final CallSessionRegistry callSessionRegistry;
    private final Clock clock;

    /**
     * 통화 요청
     * 수신자의 현재 연결과 발신 연결을 통화 Room에 넣고 각각 incoming_call, call_initiated를 보낸다.
     *
     * @throws CalleeOfflineException 수신자가 온라인이 아닌 경우
     */
    public CallSession initiate(String connectionId, Long callerId, Long calleeId, CallType callType) {
        if (callerId.equals(calleeId)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Cannot call yourself");
        }
        String calleeConnectionId = presenceRegistry.resolve(calleeId)
                .orElseThrow(() -> new CalleeOfflineException(calleeId));

        CallSession call = callSessionRegistry.open(callerId, calleeId, callType, clock.instant());
        RoomId roomId = RoomId.call(call.callId());
        if (!roomBroadcastManager.join(calleeConnectionId, roomId)) {
            callSessionRegistry.remove(call.callId());
            throw new CalleeOfflineException(calleeId);
        }
        roomBroadcastManager.join(connectionId, roomId);

        roomBroadcastManager.sendTo(calleeConnectionId, RealtimeEvent.of(INCOMING_CALL, Map.of(
                "callId", call.callId(),
                "callType", callType.getWireName(),
                "from", callerId)));
        roomBroadcastManager.sendTo(connectionId, RealtimeEvent.of(CALL_INITIATED, Map.of(
                "callId", call.callId(),
                "callType", callType.getWireName(),
                "to", calleeId,
                "status", "ringing")));
        log.info("Call initiated: callId={}, callerId={}, calleeId={}, type={}",
                call.callId(), callerId, calleeId, callType);
        return call;
    }

    public void accept(Long userId, Long callId) {
        CallSession call = callSessionRegistry.accept(callId, userId, clock.instant());
        roomBroadcastManager.broadcast(RoomId.call(callId), RealtimeEvent.of(CALL_ACCEPTED, Map.of(
                "callId", call.callId(),
                "by", userId)));
        log.info("Call accepted: callId={}, userId={}", callId, userId);
    }

    /**
     * 거절은 수락 전(RINGING)에만 가능하다. 발신자의 거절은 호출 취소로 취급한다.
     */
    public void reject(Long userId, Long callId, String reason) {
        CallSession call = callSessionRegistry.require(callId);
        call.ensureParticipant(userId);
        call.ensureRinging();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("callId", callId);
        payload.put("by", userId);
        if (reason != null) {
            payload.put("reason", reason);
        }
        roomBroadcastManager.broadcast(RoomId.call(callId), RealtimeEvent.of(CALL_REJECTED, payload));
        cleanup(callId);
        log.info("Call rejected: callId={}, userId={}, reason={}", callId, userId, reason);
    }

    public void end(Long userId, Long callId, String reason) {
        CallSession call = callSessionRegistry.require(callId);
        call.ensureParticipant(userId);
        broadcastEnded(call, userId, reason);
        cleanup(callId);
        log.info("Call ended: callId={}, userId={}, reason={}", callId, userId, reason);
    }

    /**
     * WebRTC 시그널(offer, answer, ice-candidate)을 상대 참가자에게 중계
     * 보낸 연결이 통화 Room에 가입되어 있어야 한다.
     */
    public void signal(String connectionId, Long userId, Long callId, String signalType, Object data) {
        if (!SIGNAL_TYPES.contains(signalType)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Unknown signal type: " + signalType);
        }
        if (data == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Field is required: data");
        }
        CallSession call = callSessionRegistry.require(callId);
        call.ensureParticipant(userId);
        RoomId roomId = RoomId.call(callId);
        if (!roomBroadcastManager.roomsOf(connectionId).contains(roomId)) {
            throw new BusinessException(ErrorCode.FORBIDDEN, "Not a member of room " + roomId);
        }

        roomBroadcastManager.broadcastExcept(roomId, RealtimeEvent.of(CALL_SIGNAL, Map.of(
                "callId", callId,
                "from", userId,
                "signalType", signalType,
                "data", data)), connectionId);
        log.debug("Call signal relayed: callId={}, from={}, type={}", callId, userId, signalType);
    }

    /**
     * 재접속한 참가자의 통화 Room 재가입
     */
    public void join(String connectionId, Long userId, Long callId) {
        callSessionRegistry.require(callId).ensureParticipant(userId);
        roomBroadcastManager.join(connectionId, RoomId.call(callId));
        roomBroadcastManager.sendTo(connectionId, RealtimeEvent.of("joined_call", Map.of("callId", callId)));
    }

    public void leave(String connectionId, Long callId) {
        roomBroadcastManager.leave(connectionId, RoomId.call(callId));
        roomBroadcastManager.sendTo(connectionId, RealtimeEvent.of("left_call", Map.of("callId", callId)));
    }

    /**
     * 연결 종료 처리
     * 연결이 속한 통화의 상대에게 끊김을 알리고 통화를 종료한다.
     */
    public void disconnected(String connectionId, Long userId) {
        for (RoomId roomId : Set.copyOf(roomBroadcastManager.roomsOf(connectionId))) {
            if (roomId.kind() != RoomKind.CALL) {
                continue;
            }
            callSessionRegistry.find(roomId.entityId()).ifPresent(call -> {
                roomBroadcastManager.broadcastExcept(roomId, RealtimeEvent.of(PARTICIPANT_DISCONNECTED, Map.of(
                        "callId", call.callId(),
                        "userId", userId)), connectionId);
                broadcastEnded(call, userId, "participant_disconnected");
                cleanup(call.callId());
                log.info("Call ended by disconnect: callId={}, userId={}", call.callId(), userId);
            });
        }
    }

    private void broadcastEnded(CallSession call, Long userId, String reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("callId", call.callId());
        payload.put("by", userId);
        if (reason != null) {
            payload.put("reason", reason);
        }
        payload.put("duration", call.durationSeconds(clock.instant()));
        roomBroadcastManager.broadcast(RoomId.call(call.callId()), RealtimeEvent.of(CALL_ENDED, payload));
    }

    private void cleanup(Long callId) {
        RoomId roomId = RoomId.call(callId);
        for (String member : Set.copyOf(roomBroadcastManager.members(roomId))) {
            roomBroadcastManager.leave(member, roomId);
        }
        callSessionRegistry.remove(callId);
    }
}
