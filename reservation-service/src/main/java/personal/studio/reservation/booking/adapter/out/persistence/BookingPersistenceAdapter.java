package personal.studio.reservation.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.studio.reservation.booking.application.port.out.BookingRepository;
import personal.studio.reservation.booking.domain.model.Booking;
import personal.studio.reservation.booking.domain.model.BookingStatus;
import personal.studio.reservation.catalog.application.port.out.ClassBookingCleanupPort;

import java.util.List;
import java.util.Optional;

/**
 * Booking Persistence Adapter
 * JPA를 사용한 예약 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingPersistenceAdapter implements BookingRepository, ClassBookingCleanupPort {

    private final JpaBookingRepository jpaBookingRepository;

    @Override
    public Booking save(Booking booking) {
        log.debug("Saving booking: bookingId={}, classId={}, status={}",
                booking.id(), booking.classId(), booking.status());
        BookingEntity saved = jpaBookingRepository.save(BookingEntity.fromDomain(booking));
        return saved.toDomain();
    }

    @Override
    public Optional<Booking> findById(Long bookingId) {
        log.debug("Finding booking: bookingId={}", bookingId);
        return jpaBookingRepository.findById(bookingId)
                .map(BookingEntity::toDomain);
    }

    @Override
    public Optional<BookingStatus> findCurrentStatus(Long bookingId) {
        return jpaBookingRepository.findStatusById(bookingId);
    }

    @Override
    public boolean existsConfirmed(Long userId, Long classId) {
        return jpaBookingRepository.existsByUserIdAndClassIdAndStatus(userId, classId, BookingStatus.CONFIRMED);
    }

    @Override
    public long countConfirmed(Long classId) {
        return jpaBookingRepository.countByClassIdAndStatus(classId, BookingStatus.CONFIRMED);
    }

    @Override
    public List<Booking> findByUser(Long userId, BookingStatus status) {
        List<BookingEntity> entities = status == null
                ? jpaBookingRepository.findByUserIdOrderByBookedAtDesc(userId)
                : jpaBookingRepository.findByUserIdAndStatusOrderByBookedAtDesc(userId, status);
        return entities.stream()
                .map(BookingEntity::toDomain)
                .toList();
    }

    @Override
    public List<Booking> findAll(BookingStatus status) {
        List<BookingEntity> entities = status == null
                ? jpaBookingRepository.findAllByOrderByBookedAtDesc()
                : jpaBookingRepository.findByStatusOrderByBookedAtDesc(status);
        return entities.stream()
                .map(BookingEntity::toDomain)
                .toList();
    }

    @Override
    public int deleteAllBookingsOfClass(Long classId) {
        log.debug("Deleting bookings of class: classId={}", classId);
        return jpaBookingRepository.deleteAllByClassId(classId);
    }
}
