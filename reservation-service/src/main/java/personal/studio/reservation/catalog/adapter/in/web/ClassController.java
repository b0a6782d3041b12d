package personal.studio.reservation.catalog.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.studio.common.dto.ApiResponse;
import personal.studio.reservation.catalog.adapter.in.web.dto.ClassResponse;
import personal.studio.reservation.catalog.application.port.in.GetClassesUseCase;
import personal.studio.reservation.catalog.domain.model.ClassCategory;
import personal.studio.reservation.config.CallerTimeZoneResolver;
import personal.studio.reservation.user.application.port.in.ValidateUserUseCase;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Class API Controller
 * 수업 조회 REST API (인증된 사용자 누구나)
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/classes")
@RequiredArgsConstructor
public class ClassController {

    private final GetClassesUseCase getClassesUseCase;
    private final ValidateUserUseCase validateUserUseCase;
    private final CallerTimeZoneResolver callerTimeZoneResolver;

    /**
     * 시작 전 수업 목록 조회
     * GET /api/v1/classes?category=&date=
     * date는 X-Timezone 헤더의 시간대 기준 하루로 해석한다.
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<ClassResponse>>> getUpcomingClasses(
            @RequestHeader("X-User-Id") Long userId,
            @RequestParam(required = false) ClassCategory category,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestHeader(value = CallerTimeZoneResolver.TIME_ZONE_HEADER, required = false) String timeZone
    ) {
        validateUserUseCase.validateUser(userId);
        ZoneId zone = callerTimeZoneResolver.resolve(timeZone);
        log.debug("Get upcoming classes: category={}, date={}, zone={}", category, date, zone);

        List<ClassResponse> response = getClassesUseCase.getUpcomingClasses(category, date, zone).stream()
                .map(ClassResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("Classes retrieved", response));
    }

    /**
     * 수업 단건 조회
     * GET /api/v1/classes/{classId}
     */
    @GetMapping("/{classId}")
    public ResponseEntity<ApiResponse<ClassResponse>> getClassSession(
            @PathVariable Long classId,
            @RequestHeader("X-User-Id") Long userId
    ) {
        validateUserUseCase.validateUser(userId);

        ClassResponse response = ClassResponse.from(getClassesUseCase.getClassSession(classId));
        return ResponseEntity.ok(ApiResponse.success("Class retrieved", response));
    }
}
