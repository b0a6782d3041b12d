package personal.studio.reservation.catalog.domain.exception;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

/**
 * Invalid Class Definition Exception
 * 수업 생성/수정 입력이 올바르지 않을 때 발생
 */
public class InvalidClassDefinitionException extends BusinessException {
    public InvalidClassDefinitionException(String reason) {
        super(ErrorCode.INVALID_CLASS_DEFINITION, reason);
    }
}
