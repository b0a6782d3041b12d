package personal.studio.reservation.booking.adapter.in.web.dto;

import personal.studio.reservation.booking.domain.model.Booking;
import personal.studio.reservation.booking.domain.model.BookingStatus;

import java.time.LocalDateTime;

/**
 * 예약 조회/생성 응답 DTO
 */
public record BookingResponse(
        Long bookingId,
        Long userId,
        Long classId,
        BookingStatus status,
        LocalDateTime bookedAt,
        LocalDateTime cancelledAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.id(),
                booking.userId(),
                booking.classId(),
                booking.status(),
                booking.bookedAt(),
                booking.cancelledAt()
        );
    }
}
