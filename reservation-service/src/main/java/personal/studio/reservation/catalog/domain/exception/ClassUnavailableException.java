package personal.studio.reservation.catalog.domain.exception;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

/**
 * Class Unavailable Exception
 * 이미 시작했거나 남은 좌석이 없는 수업을 예약하려 할 때 발생
 * 동시 요청이 몰리면 정상적으로 발생하는 예외
 */
public class ClassUnavailableException extends BusinessException {
    public ClassUnavailableException(Long classId, String reason) {
        super(ErrorCode.CLASS_UNAVAILABLE,
                String.format("Class is not available for booking: classId=%d, reason=%s", classId, reason));
    }
}
