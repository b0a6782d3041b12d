package personal.studio.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "C002", "인증이 필요합니다."),
    FORBIDDEN(HttpStatus.FORBIDDEN, "C003", "권한이 없습니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, "C005", "리소스 충돌이 발생했습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),

    // User
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "U001", "사용자를 찾을 수 없습니다."),

    // Class Catalog
    CLASS_NOT_FOUND(HttpStatus.NOT_FOUND, "K001", "수업을 찾을 수 없습니다."),
    INVALID_CLASS_DEFINITION(HttpStatus.BAD_REQUEST, "K002", "수업 정보가 올바르지 않습니다."),
    CLASS_CAPACITY_CONFLICT(HttpStatus.CONFLICT, "K003", "확정된 예약 수보다 정원을 줄일 수 없습니다."),

    // Booking
    CLASS_UNAVAILABLE(HttpStatus.CONFLICT, "B001", "예약 가능한 수업이 아닙니다."),
    DUPLICATE_BOOKING(HttpStatus.CONFLICT, "B002", "이미 예약한 수업입니다."),
    BOOKING_NOT_FOUND(HttpStatus.NOT_FOUND, "B003", "예약을 찾을 수 없습니다."),
    BOOKING_ACCESS_DENIED(HttpStatus.FORBIDDEN, "B004", "해당 예약에 접근할 권한이 없습니다."),

    // Storage
    STORAGE_ERROR(HttpStatus.SERVICE_UNAVAILABLE, "S001", "저장소 처리 중 오류가 발생했습니다. 잠시 후 다시 시도해주세요."),
    LOCK_TIMEOUT(HttpStatus.SERVICE_UNAVAILABLE, "S002", "요청이 몰려 처리하지 못했습니다. 잠시 후 다시 시도해주세요.");

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
