package personal.studio.reservation.booking.domain.exception;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

/**
 * Booking Access Denied Exception
 * 예약 소유자도 운영자도 아닌 사용자가 예약을 변경하려 할 때 발생
 */
public class BookingAccessDeniedException extends BusinessException {
    public BookingAccessDeniedException(Long bookingId, Long userId) {
        super(ErrorCode.BOOKING_ACCESS_DENIED,
                String.format("User %d does not have access to booking %d", userId, bookingId));
    }
}
