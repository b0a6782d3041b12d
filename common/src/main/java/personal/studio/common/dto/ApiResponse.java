package personal.studio.common.dto;

/**
 * 성공 응답과 예외가 아닌 실패 응답(예: 이미 취소된 예약)의 공통 봉투
 * 예외로 끝나는 요청은 ErrorResponse로 응답한다.
 *
 * @param result  "success" 또는 "error"
 * @param message 사람이 읽는 결과 설명
 * @param data    응답 데이터 (없으면 null)
 * @param <T>     데이터 타입
 */
public record ApiResponse<T>(
        String result,
        String message,
        T data
) {
    private static final String SUCCESS = "success";
    private static final String ERROR = "error";

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(SUCCESS, message, data);
    }

    public static ApiResponse<Void> success(String message) {
        return new ApiResponse<>(SUCCESS, message, null);
    }

    /**
     * 요청은 처리됐지만 상태 변화가 없었거나 의존 자원이 실패한 경우
     */
    public static <T> ApiResponse<T> error(String message, T data) {
        return new ApiResponse<>(ERROR, message, data);
    }

    public static ApiResponse<Void> error(String message) {
        return new ApiResponse<>(ERROR, message, null);
    }
}
