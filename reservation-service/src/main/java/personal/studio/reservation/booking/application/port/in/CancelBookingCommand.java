package personal.studio.reservation.booking.application.port.in;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;
import personal.studio.reservation.user.domain.model.User;

/**
 * Cancel Booking Command
 * 예약 취소 커맨드 (요청자 + 예약 ID)
 */
public record CancelBookingCommand(
        User actor,
        Long bookingId
) {
    public CancelBookingCommand {
        if (actor == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Actor cannot be null");
        }
        if (bookingId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking ID cannot be null");
        }
    }
}
