package personal.studio.reservation.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.studio.reservation.booking.application.port.in.GetBookingsUseCase;
import personal.studio.reservation.booking.application.port.out.BookingRepository;
import personal.studio.reservation.booking.domain.exception.BookingNotFoundException;
import personal.studio.reservation.booking.domain.model.Booking;
import personal.studio.reservation.booking.domain.model.BookingStatus;
import personal.studio.reservation.booking.domain.service.BookingAccessPolicy;
import personal.studio.reservation.user.application.port.in.GetUserUseCase;
import personal.studio.reservation.user.domain.model.User;

import java.util.List;

/**
 * Booking Query Service
 * 예약 조회 (락 없는 읽기)
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BookingQueryService implements GetBookingsUseCase {

    private final BookingRepository bookingRepository;
    private final BookingAccessPolicy bookingAccessPolicy;
    private final GetUserUseCase getUserUseCase;

    @Override
    public List<Booking> getBookings(User requester, String email, String status) {
        BookingStatus statusFilter = (status == null || status.isBlank()) ? null : BookingStatus.from(status);

        if (!requester.administrator()) {
            log.debug("Getting own bookings: userId={}, status={}", requester.id(), statusFilter);
            return bookingRepository.findByUser(requester.id(), statusFilter);
        }

        if (email == null || email.isBlank()) {
            log.debug("Getting all bookings: status={}", statusFilter);
            return bookingRepository.findAll(statusFilter);
        }

        log.debug("Getting bookings by email: email={}, status={}", email, statusFilter);
        return getUserUseCase.findUserByEmail(email)
                .map(owner -> bookingRepository.findByUser(owner.id(), statusFilter))
                .orElse(List.of());
    }

    @Override
    public Booking getBooking(User requester, Long bookingId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
        bookingAccessPolicy.authorizeRead(requester, booking);
        return booking;
    }
}
