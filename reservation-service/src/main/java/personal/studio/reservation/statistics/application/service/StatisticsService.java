package personal.studio.reservation.statistics.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.studio.reservation.booking.domain.model.BookingStatus;
import personal.studio.reservation.config.ReservationProperties;
import personal.studio.reservation.statistics.application.port.in.GetStatisticsUseCase;
import personal.studio.reservation.statistics.application.port.out.StatisticsRepository;
import personal.studio.reservation.statistics.domain.model.PopularClass;
import personal.studio.reservation.statistics.domain.model.StudioStatistics;
import personal.studio.reservation.statistics.domain.model.UpcomingClass;
import personal.studio.reservation.statistics.domain.model.UserStatistics;
import personal.studio.reservation.user.domain.model.User;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Statistics Application Service
 * 예약 현황 집계. 락 없이 읽으므로 동시 예약 중에는 약간 지난 값일 수 있다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class StatisticsService implements GetStatisticsUseCase {

    private final StatisticsRepository statisticsRepository;
    private final ReservationProperties reservationProperties;

    @Override
    public StudioStatistics getStudioStatistics(User requester) {
        requester.ensureAdministrator();

        ReservationProperties.Statistics config = reservationProperties.statistics();
        LocalDateTime since = LocalDateTime.now().minusDays(config.windowDays());

        long totalClasses = statisticsRepository.countClassesStartingFrom(since);
        long confirmed = statisticsRepository.countBookingsBookedFrom(since, BookingStatus.CONFIRMED);
        long cancelled = statisticsRepository.countBookingsBookedFrom(since, BookingStatus.CANCELLED);
        long total = statisticsRepository.countBookingsBookedFrom(since, null);
        List<PopularClass> popular = statisticsRepository.findPopularClasses(since, config.popularClassLimit());

        log.info("Studio statistics requested: adminId={}, since={}", requester.id(), since);
        return new StudioStatistics(since, totalClasses, total, confirmed, cancelled, popular);
    }

    @Override
    public UserStatistics getUserStatistics(User requester) {
        LocalDateTime now = LocalDateTime.now();
        int previewLimit = reservationProperties.statistics().upcomingPreviewLimit();

        long confirmed = statisticsRepository.countUserBookings(requester.id(), BookingStatus.CONFIRMED);
        long cancelled = statisticsRepository.countUserBookings(requester.id(), BookingStatus.CANCELLED);
        long upcoming = statisticsRepository.countUpcomingConfirmed(requester.id(), now);
        List<UpcomingClass> details = statisticsRepository.findUpcomingConfirmed(requester.id(), now, previewLimit);

        log.debug("User statistics requested: userId={}", requester.id());
        return new UserStatistics(requester, confirmed, cancelled, upcoming, details);
    }
}
