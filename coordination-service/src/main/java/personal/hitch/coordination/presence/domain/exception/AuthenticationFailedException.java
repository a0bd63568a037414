package personal.hitch.coordination.presence.domain.exception;

import personal.hitch.common.exception.BusinessException;
import personal.hitch.common.exception.ErrorCode;

/**
 * Authentication Failed Exception
 * 자격 증명이 거부되었거나 인증 도중 연결이 끊어진 경우
 * HTTP 401 / realtime authentication_error 반환용
 */
public class AuthenticationFailedException extends BusinessException {
    public AuthenticationFailedException(String reason) {
        super(ErrorCode.AUTHENTICATION_FAILED,
                String.format("Authentication failed: %s", reason));
    }
}
