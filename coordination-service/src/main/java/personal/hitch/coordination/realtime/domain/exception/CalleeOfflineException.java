package personal.hitch.coordination.realtime.domain.exception;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

/**
 * Callee Offline Exception
 * 수신자에게 인증된 연결이 없어 통화를 걸 수 없는 경우
 */
public class CalleeOfflineException extends BusinessException {
    public CalleeOfflineException(Long calleeId) {
        super(ErrorCode.NOT_FOUND, String.format("User is not online: userId=%d", calleeId));
    }
}
