package personal.studio.reservation.booking.domain.service;

import org.springframework.stereotype.Component;
import personal.studio.reservation.booking.domain.exception.BookingAccessDeniedException;
import personal.studio.reservation.booking.domain.model.Booking;
import personal.studio.reservation.user.domain.model.User;

/**
 * Booking Access Policy
 * 예약 변경/조회 권한: 운영자이거나 예약 소유자
 */
@Component
public class BookingAccessPolicy {

    public void authorizeCancellation(User actor, Booking booking) {
        authorize(actor, booking);
    }

    public void authorizeRead(User actor, Booking booking) {
        authorize(actor, booking);
    }

    private void authorize(User actor, Booking booking) {
        if (actor.administrator() || booking.isOwnedBy(actor.id())) {
            return;
        }
        throw new BookingAccessDeniedException(booking.id(), actor.id());
    }
}
