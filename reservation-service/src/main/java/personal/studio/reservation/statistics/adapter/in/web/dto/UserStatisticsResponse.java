package personal.studio.reservation.statistics.adapter.in.web.dto;

import personal.studio.reservation.statistics.domain.model.UpcomingClass;
import personal.studio.reservation.statistics.domain.model.UserStatistics;

import java.util.List;

/**
 * 사용자 통계 응답 DTO
 */
public record UserStatisticsResponse(
        Long userId,
        String name,
        String email,
        long confirmedBookings,
        long cancelledBookings,
        long upcomingClasses,
        List<UpcomingClass> upcomingClassDetails
) {
    public static UserStatisticsResponse from(UserStatistics statistics) {
        return new UserStatisticsResponse(
                statistics.user().id(),
                statistics.user().name(),
                statistics.user().email(),
                statistics.confirmedBookings(),
                statistics.cancelledBookings(),
                statistics.upcomingClasses(),
                statistics.upcomingClassDetails()
        );
    }
}
