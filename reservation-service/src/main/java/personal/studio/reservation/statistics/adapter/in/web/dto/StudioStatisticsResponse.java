package personal.studio.reservation.statistics.adapter.in.web.dto;

import personal.studio.reservation.statistics.domain.model.PopularClass;
import personal.studio.reservation.statistics.domain.model.StudioStatistics;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 운영자 통계 응답 DTO
 */
public record StudioStatisticsResponse(
        LocalDateTime since,
        long totalClasses,
        long totalBookings,
        long confirmedBookings,
        long cancelledBookings,
        List<PopularClass> popularClasses
) {
    public static StudioStatisticsResponse from(StudioStatistics statistics) {
        return new StudioStatisticsResponse(
                statistics.since(),
                statistics.totalClasses(),
                statistics.totalBookings(),
                statistics.confirmedBookings(),
                statistics.cancelledBookings(),
                statistics.popularClasses()
        );
    }
}
