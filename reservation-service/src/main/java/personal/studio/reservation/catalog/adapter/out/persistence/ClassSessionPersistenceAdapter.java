package personal.studio.reservation.catalog.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.studio.reservation.catalog.application.port.out.ClassSessionRepository;
import personal.studio.reservation.catalog.domain.model.ClassCategory;
import personal.studio.reservation.catalog.domain.model.ClassSession;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Class Session Persistence Adapter
 * JPA를 사용한 수업 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClassSessionPersistenceAdapter implements ClassSessionRepository {

    private final JpaClassSessionRepository jpaClassSessionRepository;

    @Override
    public Optional<ClassSession> findById(Long classId) {
        log.debug("Finding class by id: {}", classId);
        return jpaClassSessionRepository.findById(classId)
                .map(ClassSessionEntity::toDomain);
    }

    @Override
    public Optional<ClassSession> findByIdForUpdate(Long classId) {
        log.debug("Locking class row: classId={}", classId);
        return jpaClassSessionRepository.findByIdForUpdate(classId)
                .map(ClassSessionEntity::toDomain);
    }

    @Override
    public List<ClassSession> findUpcoming(LocalDateTime now, ClassCategory category) {
        log.debug("Finding upcoming classes: category={}", category);
        return jpaClassSessionRepository.findUpcoming(now, category)
                .stream()
                .map(ClassSessionEntity::toDomain)
                .toList();
    }

    @Override
    public List<ClassSession> findUpcomingBetween(LocalDateTime now, LocalDateTime from, LocalDateTime to,
                                                  ClassCategory category) {
        log.debug("Finding upcoming classes between {} and {}: category={}", from, to, category);
        return jpaClassSessionRepository.findUpcomingBetween(now, from, to, category)
                .stream()
                .map(ClassSessionEntity::toDomain)
                .toList();
    }

    @Override
    public ClassSession save(ClassSession classSession) {
        log.debug("Saving class: classId={}, availableSlots={}/{}",
                classSession.id(), classSession.availableSlots(), classSession.totalSlots());
        ClassSessionEntity entity = ClassSessionEntity.fromDomain(classSession);
        ClassSessionEntity saved = jpaClassSessionRepository.save(entity);
        return saved.toDomain();
    }

    @Override
    public void deleteById(Long classId) {
        log.debug("Deleting class: classId={}", classId);
        jpaClassSessionRepository.deleteById(classId);
    }
}
