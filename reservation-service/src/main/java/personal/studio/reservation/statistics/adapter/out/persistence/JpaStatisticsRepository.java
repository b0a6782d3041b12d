package personal.studio.reservation.statistics.adapter.out.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;
import personal.studio.reservation.booking.adapter.out.persistence.BookingEntity;
import personal.studio.reservation.booking.domain.model.BookingStatus;
import personal.studio.reservation.statistics.domain.model.PopularClass;
import personal.studio.reservation.statistics.domain.model.UpcomingClass;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 집계 전용 JPQL 조회
 */
public interface JpaStatisticsRepository extends Repository<BookingEntity, Long> {

    @Query("SELECT COUNT(c) FROM ClassSessionEntity c WHERE c.startTime >= :since")
    long countClassesStartingFrom(@Param("since") LocalDateTime since);

    @Query("SELECT COUNT(b) FROM BookingEntity b " +
            "WHERE b.bookedAt >= :since " +
            "AND (:status IS NULL OR b.status = :status)")
    long countBookingsBookedFrom(@Param("since") LocalDateTime since,
                                 @Param("status") BookingStatus status);

    /**
     * 확정 예약이 없는 수업도 0건으로 포함 (LEFT JOIN)
     */
    @Query("SELECT new personal.studio.reservation.statistics.domain.model.PopularClass(" +
            "c.id, c.name, c.category, c.instructor, COUNT(b.id)) " +
            "FROM ClassSessionEntity c " +
            "LEFT JOIN BookingEntity b ON b.classId = c.id AND b.status = :confirmed " +
            "WHERE c.startTime >= :since " +
            "GROUP BY c.id, c.name, c.category, c.instructor, c.startTime " +
            "ORDER BY COUNT(b.id) DESC, c.startTime ASC")
    List<PopularClass> findPopularClasses(@Param("since") LocalDateTime since,
                                          @Param("confirmed") BookingStatus confirmed,
                                          Pageable pageable);

    @Query("SELECT COUNT(b) FROM BookingEntity b WHERE b.userId = :userId AND b.status = :status")
    long countUserBookings(@Param("userId") Long userId, @Param("status") BookingStatus status);

    @Query("SELECT COUNT(b) FROM BookingEntity b, ClassSessionEntity c " +
            "WHERE c.id = b.classId AND b.userId = :userId " +
            "AND b.status = :confirmed AND c.startTime > :now")
    long countUpcomingConfirmed(@Param("userId") Long userId,
                                @Param("confirmed") BookingStatus confirmed,
                                @Param("now") LocalDateTime now);

    @Query("SELECT new personal.studio.reservation.statistics.domain.model.UpcomingClass(" +
            "b.id, c.id, c.name, c.category, c.durationMinutes, c.startTime, c.instructor) " +
            "FROM BookingEntity b, ClassSessionEntity c " +
            "WHERE c.id = b.classId AND b.userId = :userId " +
            "AND b.status = :confirmed AND c.startTime > :now " +
            "ORDER BY c.startTime ASC")
    List<UpcomingClass> findUpcomingConfirmed(@Param("userId") Long userId,
                                              @Param("confirmed") BookingStatus confirmed,
                                              @Param("now") LocalDateTime now,
                                              Pageable pageable);
}
