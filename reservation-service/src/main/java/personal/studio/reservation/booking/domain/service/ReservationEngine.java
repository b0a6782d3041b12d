package personal.studio.reservation.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;
import personal.studio.reservation.booking.application.port.out.BookingRepository;
import personal.studio.reservation.booking.domain.exception.BookingNotFoundException;
import personal.studio.reservation.booking.domain.exception.DuplicateBookingException;
import personal.studio.reservation.booking.domain.model.Booking;
import personal.studio.reservation.booking.domain.model.BookingStatus;
import personal.studio.reservation.catalog.application.port.out.ClassSessionRepository;
import personal.studio.reservation.catalog.domain.exception.ClassSessionNotFoundException;
import personal.studio.reservation.catalog.domain.exception.ClassUnavailableException;
import personal.studio.reservation.catalog.domain.model.ClassSession;

import java.time.LocalDateTime;

/**
 * Reservation Engine (Domain Service)
 * 수업 좌석 예약/취소를 하나의 트랜잭션으로 실행한다.
 * <p>
 * 모든 변경은 "수업 행 락 획득 -> 락 이후 상태로 검증 -> 예약/좌석 변경 -> 커밋" 순서를 따른다.
 * 같은 수업에 대한 요청은 수업 행 락 획득 순서대로 직렬화되고, 다른 수업끼리는 서로 막지 않는다.
 * 검증 실패 시 아무것도 쓰지 않고 예외로 롤백한다.
 * <p>
 * READ_COMMITTED: 락을 얻은 뒤의 조회(중복 예약, 예약 상태 재확인)가
 * 트랜잭션 시작 시점 스냅샷이 아니라 최신 커밋 값을 읽어야 한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationEngine {

    private final ClassSessionRepository classSessionRepository;
    private final BookingRepository bookingRepository;

    /**
     * 예약 생성
     *
     * @param userId  예약자 ID
     * @param classId 수업 ID
     * @return CONFIRMED 상태의 예약
     * @throws ClassSessionNotFoundException 수업이 없을 때
     * @throws ClassUnavailableException     이미 시작했거나 남은 좌석이 없을 때
     * @throws DuplicateBookingException     같은 수업에 CONFIRMED 예약이 이미 있을 때
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public Booking createBooking(Long userId, Long classId) {
        // 1. 수업 행 락 (다른 트랜잭션이 보유 중이면 대기)
        ClassSession classSession = classSessionRepository.findByIdForUpdate(classId)
                .orElseThrow(() -> new ClassSessionNotFoundException(classId));

        // 2. 락 이후 스냅샷으로 예약 가능 여부 검증
        LocalDateTime now = LocalDateTime.now();
        if (classSession.hasStartedAt(now)) {
            throw new ClassUnavailableException(classId, "class has already started");
        }
        if (!classSession.isBookableAt(now)) {
            throw new ClassUnavailableException(classId, "no slots left");
        }

        // 3. 중복 예약 검증 (CONFIRMED만 대상, 취소된 예약은 재예약 허용)
        if (bookingRepository.existsConfirmed(userId, classId)) {
            throw new DuplicateBookingException(userId, classId);
        }

        // 4. 예약 생성 + 5. 좌석 차감
        Booking saved = bookingRepository.save(Booking.create(userId, classId));
        ClassSession updated = classSessionRepository.save(classSession.reserveSlot());

        log.info("Booking confirmed: bookingId={}, userId={}, classId={}, availableSlots={}",
                saved.id(), userId, classId, updated.availableSlots());
        return saved;
    }

    /**
     * 예약 취소 (호출 전에 권한 검증이 끝나 있어야 한다)
     *
     * @param bookingId 예약 ID
     * @return 취소했으면 true, 이미 취소되어 변경할 것이 없으면 false
     * @throws BookingNotFoundException 예약이 없을 때
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public boolean cancelBooking(Long bookingId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));

        if (!booking.isConfirmed()) {
            log.info("Booking is not confirmed, nothing to cancel: bookingId={}, status={}",
                    bookingId, booking.status());
            return false;
        }

        ClassSession classSession = classSessionRepository.findByIdForUpdate(booking.classId())
                .orElseThrow(() -> new ClassSessionNotFoundException(booking.classId()));

        // 락 대기 중 다른 요청이 먼저 취소했을 수 있으므로 상태를 다시 읽는다
        BookingStatus currentStatus = bookingRepository.findCurrentStatus(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
        if (currentStatus != BookingStatus.CONFIRMED) {
            log.info("Booking was cancelled concurrently: bookingId={}", bookingId);
            return false;
        }

        bookingRepository.save(booking.cancel());
        ClassSession updated = classSessionRepository.save(classSession.releaseSlot());

        log.info("Booking cancelled: bookingId={}, classId={}, availableSlots={}",
                bookingId, booking.classId(), updated.availableSlots());
        return true;
    }
}
