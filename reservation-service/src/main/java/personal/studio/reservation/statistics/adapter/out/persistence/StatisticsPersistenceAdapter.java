package personal.studio.reservation.statistics.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import personal.studio.reservation.booking.domain.model.BookingStatus;
import personal.studio.reservation.statistics.application.port.out.StatisticsRepository;
import personal.studio.reservation.statistics.domain.model.PopularClass;
import personal.studio.reservation.statistics.domain.model.UpcomingClass;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Statistics Persistence Adapter
 */
@Component
@RequiredArgsConstructor
public class StatisticsPersistenceAdapter implements StatisticsRepository {

    private final JpaStatisticsRepository jpaStatisticsRepository;

    @Override
    public long countClassesStartingFrom(LocalDateTime since) {
        return jpaStatisticsRepository.countClassesStartingFrom(since);
    }

    @Override
    public long countBookingsBookedFrom(LocalDateTime since, BookingStatus status) {
        return jpaStatisticsRepository.countBookingsBookedFrom(since, status);
    }

    @Override
    public List<PopularClass> findPopularClasses(LocalDateTime since, int limit) {
        return jpaStatisticsRepository.findPopularClasses(since, BookingStatus.CONFIRMED, PageRequest.of(0, limit));
    }

    @Override
    public long countUserBookings(Long userId, BookingStatus status) {
        return jpaStatisticsRepository.countUserBookings(userId, status);
    }

    @Override
    public long countUpcomingConfirmed(Long userId, LocalDateTime now) {
        return jpaStatisticsRepository.countUpcomingConfirmed(userId, BookingStatus.CONFIRMED, now);
    }

    @Override
    public List<UpcomingClass> findUpcomingConfirmed(Long userId, LocalDateTime now, int limit) {
        return jpaStatisticsRepository.findUpcomingConfirmed(
                userId, BookingStatus.CONFIRMED, now, PageRequest.of(0, limit));
    }
}
