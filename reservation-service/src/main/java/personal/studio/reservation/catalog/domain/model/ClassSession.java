package personal.studio.reservation.catalog.domain.model;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;
import personal.studio.reservation.catalog.domain.exception.ClassCapacityConflictException;
import personal.studio.reservation.catalog.domain.exception.ClassUnavailableException;

import java.time.LocalDateTime;

/**
 * Class Session Domain Model
 * 정원이 있는 예약 가능한 수업 (불변)
 * <p>
 * availableSlots = totalSlots - (이 수업을 참조하는 CONFIRMED 예약 수)
 * availableSlots는 예약 엔진만 변경한다. (reserveSlot / releaseSlot)
 */
public record ClassSession(
        Long id,
        String name,
        ClassCategory category,
        String instructor,
        LocalDateTime startTime,
        int durationMinutes,
        int totalSlots,
        int availableSlots,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public ClassSession {
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Class name cannot be null or blank");
        }
        if (category == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Class category cannot be null");
        }
        if (startTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start time cannot be null");
        }
        if (totalSlots <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Total slots must be positive");
        }
        if (availableSlots < 0 || availableSlots > totalSlots) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Available slots out of range: available=%d, total=%d", availableSlots, totalSlots));
        }
    }

    /**
     * 수업 생성 (정적 팩토리 메서드)
     * availableSlots는 totalSlots로 초기화된다.
     *
     * @param definition 수업 정의
     * @return 새로운 수업 (ID 없음)
     */
    public static ClassSession create(ClassDefinition definition) {
        LocalDateTime now = LocalDateTime.now();
        return new ClassSession(
                null,
                definition.name(),
                definition.category(),
                definition.instructor(),
                definition.startTime(),
                definition.durationMinutes(),
                definition.totalSlots(),
                definition.totalSlots(),
                now,
                now);
    }

    /**
     * 좌석 1개 차감 (예약 생성 시)
     *
     * @throws ClassUnavailableException 남은 좌석이 없을 때
     */
    public ClassSession reserveSlot() {
        if (availableSlots <= 0) {
            throw new ClassUnavailableException(id, "no slots left");
        }
        return withAvailableSlots(availableSlots - 1);
    }

    /**
     * 좌석 1개 반환 (예약 취소 시)
     * 취소는 이전 차감과 1:1로 짝지어지므로 totalSlots를 넘을 수 없다.
     */
    public ClassSession releaseSlot() {
        if (availableSlots >= totalSlots) {
            throw new IllegalStateException(
                    String.format("Cannot release slot beyond capacity. Class ID: %d, total: %d", id, totalSlots));
        }
        return withAvailableSlots(availableSlots + 1);
    }

    /**
     * 수업 정의 변경 (운영자)
     * 이미 확정된 좌석 수는 유지하고 남은 좌석을 새 정원 기준으로 다시 계산한다.
     *
     * @throws ClassCapacityConflictException 새 정원이 확정된 좌석 수보다 작을 때
     */
    public ClassSession redefine(ClassDefinition definition) {
        int reserved = reservedSlots();
        if (definition.totalSlots() < reserved) {
            throw new ClassCapacityConflictException(id, definition.totalSlots(), reserved);
        }
        return new ClassSession(
                id,
                definition.name(),
                definition.category(),
                definition.instructor(),
                definition.startTime(),
                definition.durationMinutes(),
                definition.totalSlots(),
                definition.totalSlots() - reserved,
                createdAt,
                LocalDateTime.now());
    }

    /**
     * 확정 예약으로 점유된 좌석 수
     */
    public int reservedSlots() {
        return totalSlots - availableSlots;
    }

    /**
     * 수업 시작 여부 확인
     */
    public boolean hasStartedAt(LocalDateTime now) {
        return !startTime.isAfter(now);
    }

    /**
     * 예약 가능 여부 확인 (시작 전이고 남은 좌석이 있을 때)
     */
    public boolean isBookableAt(LocalDateTime now) {
        return !hasStartedAt(now) && availableSlots > 0;
    }

    public boolean isBookable() {
        return isBookableAt(LocalDateTime.now());
    }

    private ClassSession withAvailableSlots(int newAvailableSlots) {
        return new ClassSession(id, name, category, instructor, startTime, durationMinutes,
                totalSlots, newAvailableSlots, createdAt, LocalDateTime.now());
    }
}
