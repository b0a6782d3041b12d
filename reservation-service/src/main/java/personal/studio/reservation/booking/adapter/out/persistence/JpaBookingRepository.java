package personal.studio.reservation.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.studio.reservation.booking.domain.model.BookingStatus;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Booking
 */
public interface JpaBookingRepository extends JpaRepository<BookingEntity, Long> {

    boolean existsByUserIdAndClassIdAndStatus(Long userId, Long classId, BookingStatus status);

    long countByClassIdAndStatus(Long classId, BookingStatus status);

    /**
     * 상태 컬럼만 조회 (스칼라 쿼리이므로 매번 DB를 읽는다)
     */
    @Query("SELECT b.status FROM BookingEntity b WHERE b.id = :id")
    Optional<BookingStatus> findStatusById(@Param("id") Long id);

    List<BookingEntity> findByUserIdOrderByBookedAtDesc(Long userId);

    List<BookingEntity> findByUserIdAndStatusOrderByBookedAtDesc(Long userId, BookingStatus status);

    List<BookingEntity> findAllByOrderByBookedAtDesc();

    List<BookingEntity> findByStatusOrderByBookedAtDesc(BookingStatus status);

    @Modifying
    @Query("DELETE FROM BookingEntity b WHERE b.classId = :classId")
    int deleteAllByClassId(@Param("classId") Long classId);
}
