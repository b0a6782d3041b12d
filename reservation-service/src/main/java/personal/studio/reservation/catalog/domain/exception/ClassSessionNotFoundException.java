package personal.studio.reservation.catalog.domain.exception;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

/**
 * Class Session Not Found Exception
 * 수업을 찾을 수 없을 때 발생하는 예외
 */
public class ClassSessionNotFoundException extends BusinessException {
    public ClassSessionNotFoundException(Long classId) {
        super(ErrorCode.CLASS_NOT_FOUND, String.format("Class not found: classId=%d", classId));
    }
}
