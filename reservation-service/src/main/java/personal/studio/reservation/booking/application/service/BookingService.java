package personal.studio.reservation.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import personal.studio.reservation.booking.application.port.in.CancelBookingCommand;
import personal.studio.reservation.booking.application.port.in.CancelBookingUseCase;
import personal.studio.reservation.booking.application.port.in.CreateBookingCommand;
import personal.studio.reservation.booking.application.port.in.CreateBookingUseCase;
import personal.studio.reservation.booking.application.port.out.BookingRepository;
import personal.studio.reservation.booking.domain.exception.BookingNotFoundException;
import personal.studio.reservation.booking.domain.exception.LockTimeoutException;
import personal.studio.reservation.booking.domain.exception.StorageException;
import personal.studio.reservation.booking.domain.model.Booking;
import personal.studio.reservation.booking.domain.service.BookingAccessPolicy;
import personal.studio.reservation.booking.domain.service.ReservationEngine;

import java.util.function.Supplier;

/**
 * Booking Application Service
 * 예약 생성/취소 진입점
 * <p>
 * 트랜잭션은 ReservationEngine이 소유한다. 이 서비스는 트랜잭션 밖에서 권한을 검증하고,
 * 커밋 실패까지 포함한 저장소 예외를 StorageException/LockTimeoutException으로 변환한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService implements CreateBookingUseCase, CancelBookingUseCase {

    private final ReservationEngine reservationEngine;
    private final BookingRepository bookingRepository;
    private final BookingAccessPolicy bookingAccessPolicy;

    @Override
    public Booking createBooking(CreateBookingCommand command) {
        log.info("Creating booking: userId={}, classId={}", command.userId(), command.classId());

        Booking booking = executeInStorage(
                () -> reservationEngine.createBooking(command.userId(), command.classId()),
                String.format("classId=%d", command.classId()));

        log.info("Booking created successfully: bookingId={}, userId={}, classId={}",
                booking.id(), booking.userId(), booking.classId());
        return booking;
    }

    @Override
    public boolean cancelBooking(CancelBookingCommand command) {
        Long bookingId = command.bookingId();
        log.info("Cancelling booking: bookingId={}, actorId={}", bookingId, command.actor().id());

        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
        bookingAccessPolicy.authorizeCancellation(command.actor(), booking);

        boolean cancelled = executeInStorage(
                () -> reservationEngine.cancelBooking(bookingId),
                String.format("bookingId=%d", bookingId));

        if (!cancelled) {
            log.info("Booking already cancelled, no change: bookingId={}", bookingId);
        }
        return cancelled;
    }

    private <T> T executeInStorage(Supplier<T> operation, String target) {
        try {
            return operation.get();
        } catch (PessimisticLockingFailureException e) {
            log.warn("Could not acquire class lock in time: {}", target, e);
            throw new LockTimeoutException("Lock wait timed out: " + target, e);
        } catch (DataAccessException | TransactionException e) {
            log.error("Booking transaction failed and was rolled back: {}", target, e);
            throw new StorageException("Booking transaction failed: " + target, e);
        }
    }
}
