package personal.studio.reservation.catalog.adapter.in.web.dto;

import personal.studio.reservation.catalog.domain.model.ClassCategory;
import personal.studio.reservation.catalog.domain.model.ClassSession;

import java.time.LocalDateTime;

/**
 * 수업 조회 응답 DTO
 */
public record ClassResponse(
        Long classId,
        String name,
        ClassCategory category,
        String instructor,
        LocalDateTime startTime,
        int durationMinutes,
        int totalSlots,
        int availableSlots,
        boolean bookable
) {
    public static ClassResponse from(ClassSession classSession) {
        return new ClassResponse(
                classSession.id(),
                classSession.name(),
                classSession.category(),
                classSession.instructor(),
                classSession.startTime(),
                classSession.durationMinutes(),
                classSession.totalSlots(),
                classSession.availableSlots(),
                classSession.isBookable()
        );
    }
}
