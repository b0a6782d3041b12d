package personal.studio.reservation.booking.domain.model;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

import java.util.Locale;

/**
 * Booking Status Enum
 * 예약 상태 (CONFIRMED -> CANCELLED 단방향)
 */
public enum BookingStatus {
    /**
     * 예약 확정 (생성 시 유일한 초기 상태)
     */
    CONFIRMED,

    /**
     * 예약 취소 (종료 상태)
     */
    CANCELLED;

    /**
     * 대소문자를 구분하지 않고 상태 문자열을 변환한다.
     *
     * @throws BusinessException 알 수 없는 상태일 때 (INVALID_INPUT)
     */
    public static BookingStatus from(String value) {
        try {
            return BookingStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Unknown booking status: " + value);
        }
    }
}
