package personal.hitch.common.exception;

import java.time.LocalDateTime;

/**
 * 에러 응답 포맷
 *
 * @param code      ErrorCode의 코드 값 (예: B004)
 * @param message   사용자에게 노출할 메시지
 * @param detail    예외 상세 (식별자 등), 없으면 null
 * @param timestamp 응답 생성 시각
 */
public record ErrorResponse(
        String code,
        String message,
        String detail,
        LocalDateTime timestamp
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(errorCode.getCode(), message, null, LocalDateTime.now());
    }

    public static ErrorResponse of(ErrorCode errorCode, String message, String detail) {
        return new ErrorResponse(errorCode.getCode(), message, detail, LocalDateTime.now());
    }
}
