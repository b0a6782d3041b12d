package personal.studio.reservation.statistics.domain.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Studio Statistics
 * 운영자용 집계 (since 이후 시작하는 수업, since 이후 생성된 예약 기준)
 *
 * @param since             집계 시작 시각
 * @param totalClasses      since 이후 시작하는 수업 수
 * @param totalBookings     since 이후 생성된 예약 수 (상태 무관)
 * @param confirmedBookings 그중 CONFIRMED 수
 * @param cancelledBookings 그중 CANCELLED 수
 * @param popularClasses    확정 예약 수 내림차순 상위 수업
 */
public record StudioStatistics(
        LocalDateTime since,
        long totalClasses,
        long totalBookings,
        long confirmedBookings,
        long cancelledBookings,
        List<PopularClass> popularClasses
) {
}
