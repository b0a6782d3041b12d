package personal.studio.common.exception;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * GlobalExceptionHandler 테스트
 * 예외 종류별 HTTP Status와 에러 응답 포맷 검증
 */
@DisplayName("GlobalExceptionHandler 테스트")
class GlobalExceptionHandlerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new FailingController())
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("BusinessException은 ErrorCode의 상태와 코드로 응답한다")
    void businessException() throws Exception {
        mockMvc.perform(get("/test/business/{code}", "DUPLICATE_BOOKING"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.result").value("error"))
                .andExpect(jsonPath("$.code").value("B002"))
                .andExpect(jsonPath("$.message").value(ErrorCode.DUPLICATE_BOOKING.getMessage()))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    @DisplayName("저장소 오류는 503 S001로 응답하고 내부 상세는 노출하지 않는다")
    void storageErrorHidesDetail() throws Exception {
        mockMvc.perform(get("/test/business/{code}", "STORAGE_ERROR"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("S001"))
                .andExpect(jsonPath("$.message").value(ErrorCode.STORAGE_ERROR.getMessage()));
    }

    @Test
    @DisplayName("X-User-Id 헤더가 없으면 401 C002")
    void missingUserHeader() throws Exception {
        mockMvc.perform(get("/test/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("C002"));
    }

    @Test
    @DisplayName("헤더 형식이 숫자가 아니면 400 C001")
    void malformedUserHeader() throws Exception {
        mockMvc.perform(get("/test/me").header("X-User-Id", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));
    }

    @Test
    @DisplayName("요청 본문 검증 실패는 400 C001과 첫 번째 검증 메시지")
    void validationFailure() throws Exception {
        mockMvc.perform(post("/test/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"))
                .andExpect(jsonPath("$.message").value("classId is required"));
    }

    @Test
    @DisplayName("읽을 수 없는 본문은 400 C001")
    void unreadableBody() throws Exception {
        mockMvc.perform(post("/test/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not-json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));
    }

    @Test
    @DisplayName("정의되지 않은 필드를 거부하도록 설정되면 필드 이름과 함께 400 C001")
    void unknownFieldRejected() throws Exception {
        ObjectMapper strictMapper = Jackson2ObjectMapperBuilder.json()
                .failOnUnknownProperties(true)
                .build();
        MockMvc strictMvc = MockMvcBuilders.standaloneSetup(new FailingController())
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(strictMapper))
                .build();

        strictMvc.perform(post("/test/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"classId\": 1, \"seat\": \"A1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"))
                .andExpect(jsonPath("$.message").value("Field 'seat' is not allowed."));
    }

    @Test
    @DisplayName("예상하지 못한 예외는 500으로 응답한다")
    void unexpectedException() throws Exception {
        mockMvc.perform(get("/test/crash"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("C006"));
    }

    @RestController
    static class FailingController {

        @GetMapping("/test/business/{code}")
        String business(@PathVariable("code") ErrorCode code) {
            throw new BusinessException(code, "detail that stays in the log");
        }

        @GetMapping("/test/me")
        String me(@RequestHeader("X-User-Id") Long userId) {
            return String.valueOf(userId);
        }

        @PostMapping("/test/bookings")
        String book(@Valid @RequestBody BookingBody body) {
            return "ok";
        }

        @GetMapping("/test/crash")
        String crash() {
            throw new IllegalStateException("boom");
        }
    }

    record BookingBody(@NotNull(message = "classId is required") Long classId) {
    }
}
