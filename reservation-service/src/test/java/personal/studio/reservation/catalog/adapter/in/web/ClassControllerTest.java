package personal.studio.reservation.catalog.adapter.in.web;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;
import personal.studio.reservation.catalog.application.port.in.GetClassesUseCase;
import personal.studio.reservation.catalog.domain.model.ClassCategory;
import personal.studio.reservation.catalog.domain.model.ClassSession;
import personal.studio.reservation.config.CallerTimeZoneResolver;
import personal.studio.reservation.config.ReservationProperties;
import personal.studio.reservation.user.application.port.in.ValidateUserUseCase;
import personal.studio.reservation.user.domain.model.User;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Class Controller 단위 테스트
 * 조회 파라미터와 X-Timezone 헤더 전달 확인
 */
@WebMvcTest(ClassController.class)
@Import(CallerTimeZoneResolver.class)
@EnableConfigurationProperties(ReservationProperties.class)
@DisplayName("Class API 단위 테스트")
class ClassControllerTest {

    private static final Long USER_ID = 1L;
    private static final LocalDate DATE = LocalDate.of(2030, 1, 15);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GetClassesUseCase getClassesUseCase;
    @MockBean
    private ValidateUserUseCase validateUserUseCase;

    @BeforeEach
    void setUp() {
        given(validateUserUseCase.validateUser(USER_ID))
                .willReturn(new User(USER_ID, "User One", "user1@test.com", false));
    }

    @Test
    @DisplayName("X-Timezone 헤더의 시간대로 날짜 필터를 해석한다")
    void getUpcomingClasses_UsesCallerTimeZone() throws Exception {
        // given
        ClassSession session = new ClassSession(10L, "Sunrise Yoga", ClassCategory.YOGA, "Alice",
                LocalDateTime.of(2030, 1, 15, 7, 0), 60, 10, 4, LocalDateTime.now(), LocalDateTime.now());
        given(getClassesUseCase.getUpcomingClasses(ClassCategory.YOGA, DATE, ZoneId.of("Europe/Berlin")))
                .willReturn(List.of(session));

        // when & then
        mockMvc.perform(get("/api/v1/classes")
                        .header("X-User-Id", USER_ID)
                        .header("X-Timezone", "Europe/Berlin")
                        .param("category", "YOGA")
                        .param("date", "2030-01-15"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].classId").value(10))
                .andExpect(jsonPath("$.data[0].availableSlots").value(4));
    }

    @Test
    @DisplayName("X-Timezone 헤더가 없으면 기본 시간대(Asia/Kolkata)를 사용한다")
    void getUpcomingClasses_DefaultTimeZone() throws Exception {
        // given
        given(getClassesUseCase.getUpcomingClasses(null, DATE, ZoneId.of("Asia/Kolkata"))).willReturn(List.of());

        // when
        mockMvc.perform(get("/api/v1/classes")
                        .header("X-User-Id", USER_ID)
                        .param("date", "2030-01-15"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isEmpty());

        // then
        verify(getClassesUseCase).getUpcomingClasses(eq(null), eq(DATE), eq(ZoneId.of("Asia/Kolkata")));
    }

    @Test
    @DisplayName("잘못된 날짜 형식은 400 C001")
    void getUpcomingClasses_InvalidDate() throws Exception {
        mockMvc.perform(get("/api/v1/classes")
                        .header("X-User-Id", USER_ID)
                        .param("date", "15-01-2030"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));
    }
}
