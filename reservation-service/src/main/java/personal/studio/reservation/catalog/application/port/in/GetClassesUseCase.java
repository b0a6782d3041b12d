package personal.studio.reservation.catalog.application.port.in;

import personal.studio.reservation.catalog.domain.model.ClassCategory;
import personal.studio.reservation.catalog.domain.model.ClassSession;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Get Classes UseCase (Input Port)
 * 수업 조회 유스케이스 (락 없는 조회, 약간 지난 값일 수 있음)
 */
public interface GetClassesUseCase {

    /**
     * 수업 단건 조회
     *
     * @throws personal.studio.reservation.catalog.domain.exception.ClassSessionNotFoundException 수업이 없을 때
     */
    ClassSession getClassSession(Long classId);

    /**
     * 시작 전 수업 목록 조회
     *
     * @param category 수업 종류 (null이면 전체)
     * @param date     요청자 시간대 기준 시작 날짜 (null이면 전체)
     * @param zone     요청자 시간대 (date의 하루 범위를 계산할 때 사용)
     * @return 시작 시각 오름차순 목록
     */
    List<ClassSession> getUpcomingClasses(ClassCategory category, LocalDate date, ZoneId zone);
}
