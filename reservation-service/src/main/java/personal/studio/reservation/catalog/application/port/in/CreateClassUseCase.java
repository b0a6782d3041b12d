package personal.studio.reservation.catalog.application.port.in;

import personal.studio.reservation.catalog.domain.model.ClassDefinition;
import personal.studio.reservation.catalog.domain.model.ClassSession;

/**
 * Create Class UseCase (Input Port)
 * 수업 생성 유스케이스 (운영자)
 */
public interface CreateClassUseCase {

    /**
     * 수업 생성
     * availableSlots = totalSlots 로 초기화된다.
     *
     * @param definition 수업 정의
     * @return 생성된 수업
     * @throws personal.studio.reservation.catalog.domain.exception.InvalidClassDefinitionException
     *         정원이 0 이하이거나 시작 시각이 미래가 아닐 때
     */
    ClassSession createClass(ClassDefinition definition);
}
