package personal.studio.reservation.catalog.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.studio.reservation.catalog.application.port.in.CreateClassUseCase;
import personal.studio.reservation.catalog.application.port.in.GetClassesUseCase;
import personal.studio.reservation.catalog.application.port.in.ManageClassUseCase;
import personal.studio.reservation.catalog.application.port.out.ClassBookingCleanupPort;
import personal.studio.reservation.catalog.application.port.out.ClassSessionRepository;
import personal.studio.reservation.catalog.domain.exception.ClassSessionNotFoundException;
import personal.studio.reservation.catalog.domain.model.ClassCategory;
import personal.studio.reservation.catalog.domain.model.ClassDefinition;
import personal.studio.reservation.catalog.domain.model.ClassSession;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Class Catalog Application Service
 * 수업 정의 관리 및 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ClassCatalogService implements CreateClassUseCase, ManageClassUseCase, GetClassesUseCase {

    private final ClassSessionRepository classSessionRepository;
    private final ClassBookingCleanupPort classBookingCleanupPort;

    @Override
    @Transactional
    public ClassSession createClass(ClassDefinition definition) {
        definition.ensureStartsAfter(LocalDateTime.now());

        ClassSession saved = classSessionRepository.save(ClassSession.create(definition));
        log.info("Class created: classId={}, name={}, totalSlots={}, startTime={}",
                saved.id(), saved.name(), saved.totalSlots(), saved.startTime());
        return saved;
    }

    @Override
    @Transactional
    public ClassSession updateClass(Long classId, ClassDefinition definition) {
        definition.ensureStartsAfter(LocalDateTime.now());

        // 예약/취소와 같은 행 락을 잡아 reservedSlots 계산이 어긋나지 않게 한다.
        ClassSession current = classSessionRepository.findByIdForUpdate(classId)
                .orElseThrow(() -> new ClassSessionNotFoundException(classId));

        ClassSession saved = classSessionRepository.save(current.redefine(definition));
        log.info("Class updated: classId={}, totalSlots={}, availableSlots={}",
                classId, saved.totalSlots(), saved.availableSlots());
        return saved;
    }

    @Override
    @Transactional
    public void deleteClass(Long classId) {
        ClassSession current = classSessionRepository.findByIdForUpdate(classId)
                .orElseThrow(() -> new ClassSessionNotFoundException(classId));

        int removedBookings = classBookingCleanupPort.deleteAllBookingsOfClass(classId);
        classSessionRepository.deleteById(classId);
        log.info("Class deleted: classId={}, name={}, removedBookings={}", classId, current.name(), removedBookings);
    }

    @Override
    public ClassSession getClassSession(Long classId) {
        return classSessionRepository.findById(classId)
                .orElseThrow(() -> {
                    log.warn("Class not found: classId={}", classId);
                    return new ClassSessionNotFoundException(classId);
                });
    }

    @Override
    public List<ClassSession> getUpcomingClasses(ClassCategory category, LocalDate date, ZoneId zone) {
        LocalDateTime now = LocalDateTime.now();
        if (date == null) {
            return classSessionRepository.findUpcoming(now, category);
        }
        // 요청자 시간대의 하루를 저장 시간대(서버 기본 시간대)의 시각으로 바꾼다
        return classSessionRepository.findUpcomingBetween(
                now, toStorageTime(date.atStartOfDay(zone)), toStorageTime(date.plusDays(1).atStartOfDay(zone)),
                category);
    }

    private LocalDateTime toStorageTime(ZonedDateTime callerTime) {
        return callerTime.withZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime();
    }
}
