package personal.studio.reservation.catalog.domain.model;

import personal.studio.reservation.catalog.domain.exception.InvalidClassDefinitionException;

import java.time.LocalDateTime;

/**
 * Class Definition
 * 운영자가 입력하는 수업 정의 (생성/수정 공통)
 */
public record ClassDefinition(
        String name,
        ClassCategory category,
        String instructor,
        LocalDateTime startTime,
        int durationMinutes,
        int totalSlots
) {
    public ClassDefinition {
        if (name == null || name.isBlank()) {
            throw new InvalidClassDefinitionException("Class name cannot be null or blank");
        }
        if (category == null) {
            throw new InvalidClassDefinitionException("Class category cannot be null");
        }
        if (instructor == null || instructor.isBlank()) {
            throw new InvalidClassDefinitionException("Instructor cannot be null or blank");
        }
        if (startTime == null) {
            throw new InvalidClassDefinitionException("Start time cannot be null");
        }
        if (durationMinutes <= 0) {
            throw new InvalidClassDefinitionException("Duration must be positive: " + durationMinutes);
        }
        if (totalSlots <= 0) {
            throw new InvalidClassDefinitionException("Total slots must be positive: " + totalSlots);
        }
    }

    /**
     * 시작 시각이 기준 시각보다 엄격히 미래인지 검증
     *
     * @throws InvalidClassDefinitionException 시작 시각이 과거이거나 기준 시각과 같을 때
     */
    public void ensureStartsAfter(LocalDateTime now) {
        if (!startTime.isAfter(now)) {
            throw new InvalidClassDefinitionException(
                    String.format("The class must be scheduled for a future time: startTime=%s", startTime));
        }
    }
}
