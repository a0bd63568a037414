package personal.hitch.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "C002", "인증이 필요합니다."),
    FORBIDDEN(HttpStatus.FORBIDDEN, "C003", "권한이 없습니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, "C005", "리소스 충돌이 발생했습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),

    // Presence / Realtime (Axxx)
    AUTHENTICATION_FAILED(HttpStatus.UNAUTHORIZED, "A001", "인증 정보가 올바르지 않습니다."),
    AUTHENTICATION_REQUIRED(HttpStatus.UNAUTHORIZED, "A002", "인증되지 않은 연결입니다."),
    UNKNOWN_EVENT(HttpStatus.BAD_REQUEST, "A003", "지원하지 않는 이벤트입니다."),

    // Ride Booking (Bxxx)
    RIDE_NOT_FOUND(HttpStatus.NOT_FOUND, "B001", "운행 정보를 찾을 수 없습니다."),
    BOOKING_NOT_FOUND(HttpStatus.NOT_FOUND, "B002", "예약을 찾을 수 없습니다."),
    DUPLICATE_BOOKING(HttpStatus.CONFLICT, "B003", "이미 예약한 운행입니다."),
    INSUFFICIENT_CAPACITY(HttpStatus.CONFLICT, "B004", "남은 좌석이 부족합니다."),
    RIDE_NOT_BOOKABLE(HttpStatus.BAD_REQUEST, "B005", "예약할 수 없는 운행입니다."),
    CONCURRENT_BOOKING(HttpStatus.CONFLICT, "B006", "동시 예약 충돌이 발생했습니다."),
    INVALID_BOOKING_STATE(HttpStatus.CONFLICT, "B007", "현재 예약 상태에서는 처리할 수 없습니다."),

    // Delivery (Dxxx)
    DELIVERY_NOT_FOUND(HttpStatus.NOT_FOUND, "D001", "배송 요청을 찾을 수 없습니다."),
    DELIVERY_ALREADY_ASSIGNED(HttpStatus.CONFLICT, "D002", "이미 다른 배송원이 수락한 요청입니다."),
    DELIVERY_NOT_ACCEPTABLE(HttpStatus.BAD_REQUEST, "D003", "수락할 수 없는 배송 요청입니다."),

    // Escrow (Pxxx)
    ESCROW_NOT_FOUND(HttpStatus.NOT_FOUND, "P001", "에스크로 정보를 찾을 수 없습니다."),
    INVALID_ESCROW_TRANSITION(HttpStatus.CONFLICT, "P002", "허용되지 않는 에스크로 상태 전이입니다."),
    INVALID_ESCROW_AMOUNT(HttpStatus.BAD_REQUEST, "P003", "에스크로 금액이 올바르지 않습니다."),
    ESCROW_FUNDING_DECLINED(HttpStatus.PAYMENT_REQUIRED, "P004", "결제 대행사가 예치를 거절했습니다."),

    // External Service (Exxx)
    UPSTREAM_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "E001", "외부 서비스를 일시적으로 사용할 수 없습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
