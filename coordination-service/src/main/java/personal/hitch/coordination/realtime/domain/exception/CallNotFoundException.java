package personal.hitch.coordination.realtime.domain.exception;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

/**
 * Call Not Found Exception
 * 종료되었거나 존재하지 않는 통화
 */
public class CallNotFoundException extends BusinessException {
    public CallNotFoundException(Long callId) {
        super(ErrorCode.NOT_FOUND, String.format("Call not found: callId=%d", callId));
    }
}
