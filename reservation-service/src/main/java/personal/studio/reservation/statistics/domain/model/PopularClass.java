package personal.studio.reservation.statistics.domain.model;

import personal.studio.reservation.catalog.domain.model.ClassCategory;

/**
 * 확정 예약 수 기준 인기 수업
 */
public record PopularClass(
        Long classId,
        String name,
        ClassCategory category,
        String instructor,
        Long bookingCount
) {
}
