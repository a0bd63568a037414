package personal.hitch.coordination.realtime.domain.exception;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

/**
 * Call Access Denied Exception
 * 통화 참가자가 아닌 사용자의 요청
 */
public class CallAccessDeniedException extends BusinessException {
    public CallAccessDeniedException(Long callId, Long userId) {
        super(ErrorCode.FORBIDDEN, String.format("Access denied to call: callId=%d, userId=%d", callId, userId));
    }
}
