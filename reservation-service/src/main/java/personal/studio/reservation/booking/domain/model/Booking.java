package personal.studio.reservation.booking.domain.model;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

import java.time.LocalDateTime;

/**
 * Booking Domain Model
 * 사용자의 수업 좌석 예약 (불변)
 * 상태는 CONFIRMED -> CANCELLED 한 번만 전이되며, 예약은 삭제되지 않는다.
 */
public record Booking(
        Long id,
        Long userId,
        Long classId,
        BookingStatus status,
        LocalDateTime bookedAt,
        LocalDateTime cancelledAt) {
    public Booking {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (classId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Class ID cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking status cannot be null");
        }
        if (bookedAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking time cannot be null");
        }
        if (status == BookingStatus.CANCELLED && cancelledAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Cancelled booking must have a cancellation time");
        }
    }

    /**
     * 예약 생성 (정적 팩토리 메서드)
     *
     * @param userId  사용자 ID
     * @param classId 수업 ID
     * @return 새로운 예약 (CONFIRMED 상태)
     */
    public static Booking create(Long userId, Long classId) {
        return new Booking(
                null,
                userId,
                classId,
                BookingStatus.CONFIRMED,
                LocalDateTime.now(),
                null);
    }

    /**
     * 예약 취소 (CONFIRMED -> CANCELLED)
     */
    public Booking cancel() {
        if (status != BookingStatus.CONFIRMED) {
            throw new IllegalStateException(
                    String.format("Cannot cancel booking in %s status. Booking ID: %d", status, id));
        }
        return new Booking(id, userId, classId, BookingStatus.CANCELLED, bookedAt, LocalDateTime.now());
    }

    /**
     * 예약 확정 상태 여부 확인
     */
    public boolean isConfirmed() {
        return status == BookingStatus.CONFIRMED;
    }

    /**
     * 예약 소유자 여부 확인
     */
    public boolean isOwnedBy(Long requestUserId) {
        return userId.equals(requestUserId);
    }
}
