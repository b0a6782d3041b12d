package personal.studio.reservation.booking.domain.exception;

import personal.studio.common.exception.ErrorCode;

/**
 * Lock Timeout Exception
 * 데이터베이스 락 대기 정책(타임아웃/데드락) 안에 수업 행 락을 얻지 못했을 때 발생
 */
public class LockTimeoutException extends StorageException {
    public LockTimeoutException(String detail, Throwable cause) {
        super(ErrorCode.LOCK_TIMEOUT, detail, cause);
    }
}
