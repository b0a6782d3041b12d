package personal.studio.reservation.catalog.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.studio.common.exception.BusinessException;
import personal.studio.reservation.catalog.domain.exception.ClassCapacityConflictException;
import personal.studio.reservation.catalog.domain.exception.ClassUnavailableException;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ClassSession 도메인 모델 테스트")
class ClassSessionTest {

    private static final LocalDateTime START = LocalDateTime.now().plusDays(1);

    private ClassSession session(int total, int available, LocalDateTime startTime) {
        return new ClassSession(1L, "Sunrise Yoga", ClassCategory.YOGA, "Alice", startTime, 60,
                total, available, LocalDateTime.now(), LocalDateTime.now());
    }

    @Test
    @DisplayName("수업 생성 시 남은 좌석은 정원과 같다")
    void create_InitializesAvailableSlots() {
        // given
        ClassDefinition definition = new ClassDefinition("Sunrise Yoga", ClassCategory.YOGA, "Alice", START, 60, 10);

        // when
        ClassSession created = ClassSession.create(definition);

        // then
        assertThat(created.id()).isNull();
        assertThat(created.totalSlots()).isEqualTo(10);
        assertThat(created.availableSlots()).isEqualTo(10);
        assertThat(created.reservedSlots()).isZero();
    }

    @Test
    @DisplayName("좌석 차감 시 남은 좌석이 1 줄어든다")
    void reserveSlot_Decrements() {
        ClassSession reserved = session(10, 3, START).reserveSlot();

        assertThat(reserved.availableSlots()).isEqualTo(2);
        assertThat(reserved.totalSlots()).isEqualTo(10);
    }

    @Test
    @DisplayName("남은 좌석이 없으면 좌석 차감에 실패한다")
    void reserveSlot_NoSlotsLeft() {
        assertThatThrownBy(() -> session(1, 0, START).reserveSlot())
                .isInstanceOf(ClassUnavailableException.class)
                .hasMessageContaining("no slots left");
    }

    @Test
    @DisplayName("좌석 반환 시 남은 좌석이 1 늘어난다")
    void releaseSlot_Increments() {
        assertThat(session(10, 9, START).releaseSlot().availableSlots()).isEqualTo(10);
    }

    @Test
    @DisplayName("정원을 넘겨 좌석을 반환할 수 없다")
    void releaseSlot_BeyondCapacity() {
        assertThatThrownBy(() -> session(10, 10, START).releaseSlot())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("남은 좌석이 범위를 벗어나면 생성할 수 없다")
    void constructor_InvalidSlots() {
        assertThatThrownBy(() -> session(5, 6, START)).isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> session(5, -1, START)).isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> session(0, 0, START)).isInstanceOf(BusinessException.class);
    }

    @Test
    @DisplayName("시작 전이고 좌석이 남아 있을 때만 예약 가능하다")
    void isBookableAt() {
        LocalDateTime now = LocalDateTime.now();

        assertThat(session(10, 1, now.plusMinutes(1)).isBookableAt(now)).isTrue();
        assertThat(session(10, 0, now.plusMinutes(1)).isBookableAt(now)).isFalse();
        assertThat(session(10, 5, now).isBookableAt(now)).isFalse();
        assertThat(session(10, 5, now.minusHours(1)).isBookableAt(now)).isFalse();
    }

    @Test
    @DisplayName("정의 변경 시 확정 좌석 수를 유지하고 남은 좌석을 다시 계산한다")
    void redefine_KeepsReservedSlots() {
        // given: 정원 10, 확정 4
        ClassSession current = session(10, 6, START);
        ClassDefinition definition = new ClassDefinition("Power Yoga", ClassCategory.YOGA, "Alice", START, 45, 5);

        // when
        ClassSession redefined = current.redefine(definition);

        // then
        assertThat(redefined.name()).isEqualTo("Power Yoga");
        assertThat(redefined.totalSlots()).isEqualTo(5);
        assertThat(redefined.availableSlots()).isEqualTo(1);
        assertThat(redefined.reservedSlots()).isEqualTo(4);
    }

    @Test
    @DisplayName("확정 좌석 수보다 작은 정원으로 변경할 수 없다")
    void redefine_BelowReserved() {
        ClassSession current = session(10, 6, START);
        ClassDefinition definition = new ClassDefinition("Sunrise Yoga", ClassCategory.YOGA, "Alice", START, 60, 3);

        assertThatThrownBy(() -> current.redefine(definition))
                .isInstanceOf(ClassCapacityConflictException.class);
    }
}
