package personal.studio.reservation.statistics.domain.model;

import personal.studio.reservation.catalog.domain.model.ClassCategory;

import java.time.LocalDateTime;

/**
 * 사용자가 확정 예약한 시작 전 수업
 */
public record UpcomingClass(
        Long bookingId,
        Long classId,
        String name,
        ClassCategory category,
        int durationMinutes,
        LocalDateTime startTime,
        String instructor
) {
}
