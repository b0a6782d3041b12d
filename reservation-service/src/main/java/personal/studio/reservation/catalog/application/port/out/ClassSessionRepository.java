package personal.studio.reservation.catalog.application.port.out;

import personal.studio.reservation.catalog.domain.model.ClassCategory;
import personal.studio.reservation.catalog.domain.model.ClassSession;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Class Session Repository (Output Port)
 * 수업 저장소 인터페이스
 */
public interface ClassSessionRepository {

    /**
     * 수업 ID로 조회 (락 없음, 화면 표시용)
     *
     * @param classId 수업 ID
     * @return 수업 정보
     */
    Optional<ClassSession> findById(Long classId);

    /**
     * 수업 ID로 조회하며 해당 행에 배타 락을 건다.
     * 락은 현재 트랜잭션이 커밋/롤백될 때까지 유지되고,
     * 다른 트랜잭션이 락을 보유 중이면 해제될 때까지 대기한다.
     * 반드시 트랜잭션 안에서 호출해야 한다.
     *
     * @param classId 수업 ID
     * @return 락이 걸린 최신 수업 정보
     */
    Optional<ClassSession> findByIdForUpdate(Long classId);

    /**
     * 시작 전인 수업 목록 조회 (시작 시각 오름차순)
     *
     * @param now      기준 시각
     * @param category 수업 종류 (null이면 전체)
     * @return 수업 목록
     */
    List<ClassSession> findUpcoming(LocalDateTime now, ClassCategory category);

    /**
     * 시작 전이면서 [from, to) 사이에 시작하는 수업 목록 조회
     *
     * @param now      기준 시각
     * @param from     시작 시각 하한 (포함)
     * @param to       시작 시각 상한 (미포함)
     * @param category 수업 종류 (null이면 전체)
     * @return 수업 목록
     */
    List<ClassSession> findUpcomingBetween(LocalDateTime now, LocalDateTime from, LocalDateTime to,
                                           ClassCategory category);

    /**
     * 수업 저장 (생성 또는 변경)
     *
     * @param classSession 수업 정보
     * @return 저장된 수업 정보 (ID 포함)
     */
    ClassSession save(ClassSession classSession);

    /**
     * 수업 삭제
     *
     * @param classId 수업 ID
     */
    void deleteById(Long classId);
}
