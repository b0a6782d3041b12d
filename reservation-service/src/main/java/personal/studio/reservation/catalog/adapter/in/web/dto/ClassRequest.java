package personal.studio.reservation.catalog.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import personal.studio.reservation.catalog.domain.model.ClassCategory;
import personal.studio.reservation.catalog.domain.model.ClassDefinition;

import java.time.LocalDateTime;

/**
 * 수업 생성/수정 요청 DTO (운영자)
 */
public record ClassRequest(
        @NotBlank(message = "수업 이름은 필수입니다.")
        String name,

        @NotNull(message = "수업 종류는 필수입니다.")
        ClassCategory category,

        @NotBlank(message = "강사 이름은 필수입니다.")
        String instructor,

        @NotNull(message = "시작 시각은 필수입니다.")
        LocalDateTime startTime,

        @NotNull(message = "수업 시간은 필수입니다.")
        @Positive(message = "수업 시간은 0보다 커야 합니다.")
        Integer durationMinutes,

        @NotNull(message = "정원은 필수입니다.")
        @Positive(message = "정원은 0보다 커야 합니다.")
        Integer totalSlots
) {
    public ClassDefinition toDefinition() {
        return new ClassDefinition(name, category, instructor, startTime, durationMinutes, totalSlots);
    }
}
