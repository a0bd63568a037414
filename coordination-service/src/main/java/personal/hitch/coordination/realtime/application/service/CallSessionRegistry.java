package personal.hitch.coordination.realtime.application.service;

import org.springframework.stereotype.Component;
import personal.hitch.coordination.realtime.domain.exception.CallNotFoundException;
import personal.hitch.coordination.realtime.domain.model.CallSession;
import personal.hitch.coordination.realtime.domain.model.CallType;
import personal.hitch.coordination.room.application.port.out.RoomLifecycleListener;
import personal.hitch.coordination.room.domain.model.RoomId;
import personal.hitch.coordination.room.domain.model.RoomKind;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 진행 중인 통화 세션 저장소
 * 통화 Room(call:{id})이 사라지면 세션도 함께 제거된다.
 */
@Component
public class CallSessionRegistry implements RoomLifecycleListener {

    private final AtomicLong sequence = new AtomicLong();
    private final ConcurrentHashMap<Long, CallSession> calls = new ConcurrentHashMap<>();

    public CallSession open(Long callerId, Long calleeId, CallType callType, Instant now) {
        CallSession call = CallSession.ringing(sequence.incrementAndGet(), callerId, calleeId, callType, now);
        calls.put(call.callId(), call);
        return call;
    }

    public CallSession require(Long callId) {
        return find(callId).orElseThrow(() -> new CallNotFoundException(callId));
    }

    public Optional<CallSession> find(Long callId) {
        return Optional.ofNullable(calls.get(callId));
    }

    /**
     * 수락 (원자적으로 상태 전이)
     */
    public CallSession accept(Long callId, Long userId, Instant now) {
        CallSession accepted = calls.computeIfPresent(callId, (id, call) -> call.accept(userId, now));
        if (accepted == null) {
            throw new CallNotFoundException(callId);
        }
        return accepted;
    }

    public Optional<CallSession> remove(Long callId) {
        return Optional.ofNullable(calls.remove(callId));
    }

    public int activeCount() {
        return calls.size();
    }

    @Override
    public void onRoomDestroyed(RoomId roomId) {
        if (roomId.kind() == RoomKind.CALL) {
            calls.remove(roomId.entityId());
        }
    }
}
