package personal.studio.reservation.booking.domain.exception;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

/**
 * Storage Exception
 * 예약 트랜잭션을 완료하지 못했을 때 발생 (전체 롤백됨)
 * 잠금 상태에서 다시 검증하므로 호출자는 그대로 재시도해도 안전하다.
 */
public class StorageException extends BusinessException {

    public StorageException(String detail, Throwable cause) {
        this(ErrorCode.STORAGE_ERROR, detail, cause);
    }

    protected StorageException(ErrorCode errorCode, String detail, Throwable cause) {
        super(errorCode, detail, cause);
    }
}
