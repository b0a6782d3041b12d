package personal.studio.reservation.catalog.domain.exception;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

/**
 * Class Capacity Conflict Exception
 * 확정된 예약 수보다 작은 정원으로 수정하려 할 때 발생
 */
public class ClassCapacityConflictException extends BusinessException {
    public ClassCapacityConflictException(Long classId, int requestedTotal, int reserved) {
        super(ErrorCode.CLASS_CAPACITY_CONFLICT,
                String.format("Total slots cannot go below confirmed bookings: classId=%d, requested=%d, reserved=%d",
                        classId, requestedTotal, reserved));
    }
}
