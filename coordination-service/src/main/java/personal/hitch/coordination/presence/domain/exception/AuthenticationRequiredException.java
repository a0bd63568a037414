package personal.hitch.coordination.presence.domain.exception;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

/**
 * Authentication Required Exception
 * 인증되지 않은 연결이 인증이 필요한 이벤트를 보낸 경우
 */
public class AuthenticationRequiredException extends BusinessException {
    public AuthenticationRequiredException(String connectionId) {
        super(ErrorCode.AUTHENTICATION_REQUIRED,
                String.format("Connection is not authenticated: connectionId=%s", connectionId));
    }
}
