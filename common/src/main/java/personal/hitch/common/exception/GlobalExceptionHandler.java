package personal.hitch.common.exception;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;

/**
 * 전역 예외 처리 핸들러
 * BusinessException은 ErrorCode의 상태 코드로, 불변식 위반(IllegalStateException)은 500으로 응답한다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String DEFAULT_VALIDATION_MESSAGE = "입력값이 유효하지 않습니다.";
    private static final String UPSTREAM_RETRY_AFTER_SECONDS = "1";

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        log.warn("Business rule rejected request: code={}, detail={}", errorCode.getCode(), e.getMessage());
        return respond(errorCode, ErrorResponse.of(errorCode, errorCode.getMessage(), e.getMessage()));
    }

    /**
     * 외부 협력 서비스 장애: 클라이언트가 잠시 후 재시도하도록 Retry-After를 함께 보낸다.
     */
    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUpstreamUnavailableException(UpstreamUnavailableException e) {
        log.error("Upstream unavailable: {}", e.getMessage(), e.getCause());
        ErrorCode errorCode = e.getErrorCode();
        return ResponseEntity.status(errorCode.getHttpStatus())
                .header(HttpHeaders.RETRY_AFTER, UPSTREAM_RETRY_AFTER_SECONDS)
                .body(ErrorResponse.of(errorCode, errorCode.getMessage(), e.getMessage()));
    }

    // ========== 요청 형식 오류 (400) ==========

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValidException(MethodArgumentNotValidException e) {
        return invalidInput(firstMessage(e.getBindingResult().getAllErrors()));
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleHandlerMethodValidationException(HandlerMethodValidationException e) {
        return invalidInput(firstMessage(e.getAllErrors()));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolationException(ConstraintViolationException e) {
        return invalidInput(e.getMessage());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingServletRequestParameterException(
            MissingServletRequestParameterException e) {
        return invalidInput("필수 파라미터가 누락되었습니다: " + e.getParameterName());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentTypeMismatchException(
            MethodArgumentTypeMismatchException e) {
        return invalidInput("파라미터 형식이 올바르지 않습니다: " + e.getName());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadableException(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return invalidInput("요청 본문 형식이 올바르지 않습니다.");
    }

    // ========== 그 외 ==========

    /**
     * 호출자 식별 헤더(X-User-Id) 누락은 인증 실패로 본다.
     */
    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingRequestHeaderException(MissingRequestHeaderException e) {
        log.warn("Missing header: {}", e.getHeaderName());
        return respond(ErrorCode.UNAUTHORIZED,
                ErrorResponse.of(ErrorCode.UNAUTHORIZED, "필수 헤더가 누락되었습니다: " + e.getHeaderName()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFoundException(NoResourceFoundException e) {
        return respond(ErrorCode.NOT_FOUND,
                ErrorResponse.of(ErrorCode.NOT_FOUND, "요청한 URL을 찾을 수 없습니다: " + e.getResourcePath()));
    }

    // 불변식 위반은 복구하지 않고 그대로 드러낸다
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalStateException(IllegalStateException e) {
        log.error("Invariant violation detected", e);
        return internalError();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unexpected exception occurred", e);
        return internalError();
    }

    private ResponseEntity<ErrorResponse> invalidInput(String message) {
        log.warn("Invalid request: {}", message);
        return respond(ErrorCode.INVALID_INPUT, ErrorResponse.of(ErrorCode.INVALID_INPUT, message));
    }

    private ResponseEntity<ErrorResponse> internalError() {
        return respond(ErrorCode.INTERNAL_SERVER_ERROR,
                ErrorResponse.of(ErrorCode.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_SERVER_ERROR.getMessage()));
    }

    private ResponseEntity<ErrorResponse> respond(ErrorCode errorCode, ErrorResponse body) {
        return ResponseEntity.status(errorCode.getHttpStatus()).body(body);
    }

    private String firstMessage(List<? extends MessageSourceResolvable> errors) {
        if (errors.isEmpty() || errors.get(0).getDefaultMessage() == null) {
            return DEFAULT_VALIDATION_MESSAGE;
        }
        return errors.get(0).getDefaultMessage();
    }
}
