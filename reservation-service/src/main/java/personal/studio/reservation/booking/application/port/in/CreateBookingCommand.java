package personal.studio.reservation.booking.application.port.in;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

/**
 * Create Booking Command
 * 예약 생성 커맨드
 */
public record CreateBookingCommand(
        Long userId,
        Long classId
) {
    public CreateBookingCommand {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (classId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Class ID cannot be null");
        }
    }
}
