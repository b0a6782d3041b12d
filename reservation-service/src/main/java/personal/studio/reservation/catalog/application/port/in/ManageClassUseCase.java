package personal.studio.reservation.catalog.application.port.in;

import personal.studio.reservation.catalog.domain.model.ClassDefinition;
import personal.studio.reservation.catalog.domain.model.ClassSession;

/**
 * Manage Class UseCase (Input Port)
 * 수업 수정/삭제 유스케이스 (운영자)
 */
public interface ManageClassUseCase {

    /**
     * 수업 정의 수정
     * 확정된 좌석 수는 유지되고 남은 좌석이 새 정원 기준으로 재계산된다.
     *
     * @throws personal.studio.reservation.catalog.domain.exception.ClassSessionNotFoundException 수업이 없을 때
     * @throws personal.studio.reservation.catalog.domain.exception.ClassCapacityConflictException
     *         새 정원이 확정된 좌석 수보다 작을 때
     */
    ClassSession updateClass(Long classId, ClassDefinition definition);

    /**
     * 수업 삭제 (예약 이력 포함)
     *
     * @throws personal.studio.reservation.catalog.domain.exception.ClassSessionNotFoundException 수업이 없을 때
     */
    void deleteClass(Long classId);
}
