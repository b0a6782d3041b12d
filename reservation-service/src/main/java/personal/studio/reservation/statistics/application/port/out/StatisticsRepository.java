package personal.studio.reservation.statistics.application.port.out;

import personal.studio.reservation.booking.domain.model.BookingStatus;
import personal.studio.reservation.statistics.domain.model.PopularClass;
import personal.studio.reservation.statistics.domain.model.UpcomingClass;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Statistics Repository (Output Port)
 * 집계용 읽기 전용 조회 (락 없음)
 */
public interface StatisticsRepository {

    long countClassesStartingFrom(LocalDateTime since);

    /**
     * @param status null이면 상태 무관
     */
    long countBookingsBookedFrom(LocalDateTime since, BookingStatus status);

    List<PopularClass> findPopularClasses(LocalDateTime since, int limit);

    long countUserBookings(Long userId, BookingStatus status);

    long countUpcomingConfirmed(Long userId, LocalDateTime now);

    List<UpcomingClass> findUpcomingConfirmed(Long userId, LocalDateTime now, int limit);
}
