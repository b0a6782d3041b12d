package personal.studio.reservation.catalog.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.studio.reservation.catalog.domain.model.ClassCategory;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for ClassSession
 */
public interface JpaClassSessionRepository extends JpaRepository<ClassSessionEntity, Long> {

    /**
     * 비관적 쓰기 락으로 수업 조회 (SELECT ... FOR UPDATE)
     * 같은 수업에 대한 예약/취소 트랜잭션은 이 행에서 직렬화된다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM ClassSessionEntity c WHERE c.id = :id")
    Optional<ClassSessionEntity> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT c FROM ClassSessionEntity c " +
            "WHERE c.startTime > :now " +
            "AND (:category IS NULL OR c.category = :category) " +
            "ORDER BY c.startTime ASC")
    List<ClassSessionEntity> findUpcoming(@Param("now") LocalDateTime now,
                                          @Param("category") ClassCategory category);

    @Query("SELECT c FROM ClassSessionEntity c " +
            "WHERE c.startTime > :now " +
            "AND c.startTime >= :from AND c.startTime < :to " +
            "AND (:category IS NULL OR c.category = :category) " +
            "ORDER BY c.startTime ASC")
    List<ClassSessionEntity> findUpcomingBetween(@Param("now") LocalDateTime now,
                                                 @Param("from") LocalDateTime from,
                                                 @Param("to") LocalDateTime to,
                                                 @Param("category") ClassCategory category);
}
