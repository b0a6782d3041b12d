package personal.studio.reservation.catalog.application.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.studio.reservation.catalog.application.port.out.ClassBookingCleanupPort;
import personal.studio.reservation.catalog.application.port.out.ClassSessionRepository;
import personal.studio.reservation.catalog.domain.exception.ClassCapacityConflictException;
import personal.studio.reservation.catalog.domain.exception.ClassSessionNotFoundException;
import personal.studio.reservation.catalog.domain.exception.InvalidClassDefinitionException;
import personal.studio.reservation.catalog.domain.model.ClassCategory;
import personal.studio.reservation.catalog.domain.model.ClassDefinition;
import personal.studio.reservation.catalog.domain.model.ClassSession;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("ClassCatalogService 단위 테스트")
class ClassCatalogServiceTest {

    private static final Long CLASS_ID = 10L;

    @Mock
    private ClassSessionRepository classSessionRepository;
    @Mock
    private ClassBookingCleanupPort classBookingCleanupPort;
    @InjectMocks
    private ClassCatalogService classCatalogService;

    private final LocalDateTime tomorrow = LocalDateTime.now().plusDays(1);

    private ClassSession existing(int total, int available) {
        return new ClassSession(CLASS_ID, "Sunrise Yoga", ClassCategory.YOGA, "Alice", tomorrow, 60,
                total, available, LocalDateTime.now(), LocalDateTime.now());
    }

    @Test
    @DisplayName("수업 생성 - 남은 좌석을 정원으로 초기화해 저장한다")
    void createClass_Success() {
        // given
        ClassDefinition definition = new ClassDefinition("Sunrise Yoga", ClassCategory.YOGA, "Alice", tomorrow, 60, 10);
        given(classSessionRepository.save(any(ClassSession.class))).willAnswer(invocation -> {
            ClassSession s = invocation.getArgument(0);
            return new ClassSession(CLASS_ID, s.name(), s.category(), s.instructor(), s.startTime(),
                    s.durationMinutes(), s.totalSlots(), s.availableSlots(), s.createdAt(), s.updatedAt());
        });

        // when
        ClassSession created = classCatalogService.createClass(definition);

        // then
        assertThat(created.id()).isEqualTo(CLASS_ID);
        assertThat(created.availableSlots()).isEqualTo(10);
    }

    @Test
    @DisplayName("수업 생성 - 과거 시작 시각은 저장하지 않는다")
    void createClass_PastStartTime() {
        ClassDefinition definition = new ClassDefinition("Sunrise Yoga", ClassCategory.YOGA, "Alice",
                LocalDateTime.now().minusMinutes(1), 60, 10);

        assertThatThrownBy(() -> classCatalogService.createClass(definition))
                .isInstanceOf(InvalidClassDefinitionException.class);
        verify(classSessionRepository, never()).save(any());
    }

    @Test
    @DisplayName("수업 수정 - 락을 잡고 확정 좌석을 유지한 채 저장한다")
    void updateClass_Success() {
        given(classSessionRepository.findByIdForUpdate(CLASS_ID)).willReturn(Optional.of(existing(10, 7)));
        given(classSessionRepository.save(any(ClassSession.class))).willAnswer(invocation -> invocation.getArgument(0));
        ClassDefinition definition = new ClassDefinition("Sunrise Yoga", ClassCategory.YOGA, "Alice", tomorrow, 60, 20);

        ClassSession updated = classCatalogService.updateClass(CLASS_ID, definition);

        assertThat(updated.totalSlots()).isEqualTo(20);
        assertThat(updated.availableSlots()).isEqualTo(17);
    }

    @Test
    @DisplayName("수업 수정 - 확정 좌석보다 작은 정원은 거부한다")
    void updateClass_CapacityConflict() {
        given(classSessionRepository.findByIdForUpdate(CLASS_ID)).willReturn(Optional.of(existing(10, 2)));
        ClassDefinition definition = new ClassDefinition("Sunrise Yoga", ClassCategory.YOGA, "Alice", tomorrow, 60, 5);

        assertThatThrownBy(() -> classCatalogService.updateClass(CLASS_ID, definition))
                .isInstanceOf(ClassCapacityConflictException.class);
        verify(classSessionRepository, never()).save(any());
    }

    @Test
    @DisplayName("수업 삭제 - 예약을 함께 삭제한다")
    void deleteClass_Success() {
        given(classSessionRepository.findByIdForUpdate(CLASS_ID)).willReturn(Optional.of(existing(10, 8)));
        given(classBookingCleanupPort.deleteAllBookingsOfClass(CLASS_ID)).willReturn(2);

        classCatalogService.deleteClass(CLASS_ID);

        verify(classBookingCleanupPort).deleteAllBookingsOfClass(CLASS_ID);
        verify(classSessionRepository).deleteById(CLASS_ID);
    }

    @Test
    @DisplayName("수업 삭제 - 없는 수업은 ClassSessionNotFoundException")
    void deleteClass_NotFound() {
        given(classSessionRepository.findByIdForUpdate(CLASS_ID)).willReturn(Optional.empty());

        assertThatThrownBy(() -> classCatalogService.deleteClass(CLASS_ID))
                .isInstanceOf(ClassSessionNotFoundException.class);
        verify(classBookingCleanupPort, never()).deleteAllBookingsOfClass(any());
    }

    @Test
    @DisplayName("수업 목록 - 날짜가 있으면 해당 날짜의 시작 전 수업만 조회한다")
    void getUpcomingClasses_ByDate() {
        LocalDate date = LocalDate.now().plusDays(3);
        ZoneId serverZone = ZoneId.systemDefault();
        given(classSessionRepository.findUpcomingBetween(any(LocalDateTime.class),
                eq(date.atStartOfDay()), eq(date.plusDays(1).atStartOfDay()), eq(ClassCategory.HIIT)))
                .willReturn(List.of());

        assertThat(classCatalogService.getUpcomingClasses(ClassCategory.HIIT, date, serverZone)).isEmpty();
    }

    @Test
    @DisplayName("수업 목록 - 날짜는 요청자 시간대의 하루로 해석해 저장 시간대로 변환한다")
    void getUpcomingClasses_ByDateInCallerZone() {
        // given: 서버 시간대와 다른 요청자 시간대
        LocalDate date = LocalDate.now().plusDays(3);
        ZoneId serverZone = ZoneId.systemDefault();
        ZoneId callerZone = "Pacific/Auckland".equals(serverZone.getId())
                ? ZoneId.of("America/New_York")
                : ZoneId.of("Pacific/Auckland");
        LocalDateTime expectedFrom = date.atStartOfDay(callerZone)
                .withZoneSameInstant(serverZone).toLocalDateTime();
        LocalDateTime expectedTo = date.plusDays(1).atStartOfDay(callerZone)
                .withZoneSameInstant(serverZone).toLocalDateTime();
        given(classSessionRepository.findUpcomingBetween(any(LocalDateTime.class),
                any(LocalDateTime.class), any(LocalDateTime.class), eq(null)))
                .willReturn(List.of());

        // when
        classCatalogService.getUpcomingClasses(null, date, callerZone);

        // then
        ArgumentCaptor<LocalDateTime> from = ArgumentCaptor.forClass(LocalDateTime.class);
        ArgumentCaptor<LocalDateTime> to = ArgumentCaptor.forClass(LocalDateTime.class);
        verify(classSessionRepository).findUpcomingBetween(any(LocalDateTime.class),
                from.capture(), to.capture(), eq(null));
        assertThat(from.getValue()).isEqualTo(expectedFrom);
        assertThat(to.getValue()).isEqualTo(expectedTo);
        assertThat(from.getValue().atZone(serverZone).toInstant())
                .isEqualTo(date.atStartOfDay(callerZone).toInstant());
    }

    @Test
    @DisplayName("수업 목록 - 날짜가 없으면 시작 전 수업 전체를 조회한다")
    void getUpcomingClasses_All() {
        given(classSessionRepository.findUpcoming(any(LocalDateTime.class), eq(null)))
                .willReturn(List.of(existing(10, 10)));

        assertThat(classCatalogService.getUpcomingClasses(null, null, ZoneId.systemDefault())).hasSize(1);
    }
}
