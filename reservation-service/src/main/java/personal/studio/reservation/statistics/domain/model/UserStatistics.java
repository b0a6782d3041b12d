package personal.studio.reservation.statistics.domain.model;

import personal.studio.reservation.user.domain.model.User;

import java.util.List;

/**
 * User Statistics
 * 사용자 본인의 예약 현황
 */
public record UserStatistics(
        User user,
        long confirmedBookings,
        long cancelledBookings,
        long upcomingClasses,
        List<UpcomingClass> upcomingClassDetails
) {
}
