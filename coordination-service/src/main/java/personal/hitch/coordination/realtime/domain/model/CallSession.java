package personal.hitch.coordination.realtime.domain.model;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;
import personal.hitch.coordination.realtime.domain.exception.CallAccessDeniedException;

import java.time.Duration;
import java.time.Instant;

/**
 * Call Session Domain Model
 * 1:1 음성/영상 통화 세션 (불변)
 *
 * 시그널링 중계만 담당하며 미디어는 참가자 간에 직접 오간다.
 */
public record CallSession(
        Long callId,
        Long callerId,
        Long calleeId,
        CallType callType,
        CallStatus status,
        Instant startedAt,
        Instant acceptedAt) {

    public CallSession {
        if (callId == null || callerId == null || calleeId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Call participants cannot be null");
        }
        if (callerId.equals(calleeId)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Cannot call yourself");
        }
        if (callType == null || status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Call type and status cannot be null");
        }
    }

    public static CallSession ringing(Long callId, Long callerId, Long calleeId, CallType callType, Instant now) {
        return new CallSession(callId, callerId, calleeId, callType, CallStatus.RINGING, now, null);
    }

    /**
     * RINGING -> ACTIVE (수신자만)
     */
    public CallSession accept(Long userId, Instant now) {
        if (!calleeId.equals(userId)) {
            throw new CallAccessDeniedException(callId, userId);
        }
        ensureRinging();
        return new CallSession(callId, callerId, calleeId, callType, CallStatus.ACTIVE, startedAt, now);
    }

    public void ensureParticipant(Long userId) {
        if (!isParticipant(userId)) {
            throw new CallAccessDeniedException(callId, userId);
        }
    }

    public void ensureRinging() {
        if (status != CallStatus.RINGING) {
            throw new BusinessException(ErrorCode.CONFLICT,
                    String.format("Call is not ringing: callId=%d, status=%s", callId, status));
        }
    }

    public boolean isParticipant(Long userId) {
        return callerId.equals(userId) || calleeId.equals(userId);
    }

    /**
     * 통화 시간(초), 수락 전이면 0
     */
    public long durationSeconds(Instant now) {
        if (acceptedAt == null) {
            return 0;
        }
        return Math.max(0, Duration.between(acceptedAt, now).getSeconds());
    }
}
