package personal.studio.common.exception;

import java.time.LocalDateTime;

/**
 * 에러 응답 포맷
 *
 * @param result    항상 "error"
 * @param code      ErrorCode의 응답 코드 (예: B001)
 * @param message   사용자에게 노출할 메시지
 * @param timestamp 에러 발생 시각
 */
public record ErrorResponse(
        String result,
        String code,
        String message,
        LocalDateTime timestamp
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse("error", errorCode.getCode(), message, LocalDateTime.now());
    }
}
