package personal.studio.reservation.booking.domain.exception;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

/**
 * Duplicate Booking Exception
 * 같은 수업에 이미 CONFIRMED 예약이 있는 사용자가 다시 예약할 때 발생
 */
public class DuplicateBookingException extends BusinessException {
    public DuplicateBookingException(Long userId, Long classId) {
        super(ErrorCode.DUPLICATE_BOOKING,
                String.format("User already has a confirmed booking: userId=%d, classId=%d", userId, classId));
    }
}
