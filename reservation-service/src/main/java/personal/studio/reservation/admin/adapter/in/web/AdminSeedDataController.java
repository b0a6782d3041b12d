package personal.studio.reservation.admin.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.studio.common.dto.ApiResponse;
import personal.studio.reservation.admin.application.service.SeedDataInitService;

import java.util.Map;

/**
 * Admin Seed Data Controller
 *
 * WARNING: 로컬 개발/데모 전용 API입니다.
 * 프로덕션 환경에서는 자동 비활성화됩니다. (@Profile("!prod"))
 */
@Slf4j
@RestController
@RequestMapping("/api/admin")
@Profile("!prod")
@RequiredArgsConstructor
public class AdminSeedDataController {

    private final SeedDataInitService seedDataInitService;

    /**
     * 시드 데이터 초기화
     *
     * - 기존 데이터 삭제 (bookings, class_sessions, users)
     * - 운영자 2명, 일반 사용자 2명 (user1@test.com, user2@test.com)
     * - 예정 수업 2개, 지난 수업 2개
     * - 확정/취소 예약 6건
     */
    @PostMapping("/seed-data")
    public ResponseEntity<ApiResponse<Map<String, Long>>> initializeSeedData() {
        log.info("Initializing seed data via API...");

        long startTime = System.currentTimeMillis();
        Map<String, Long> counts = seedDataInitService.initializeSeedData();
        long duration = System.currentTimeMillis() - startTime;

        log.info("Seed data initialized successfully in {}ms - Users: {}, Classes: {}, Bookings: {}",
                duration, counts.get("users"), counts.get("classes"), counts.get("bookings"));

        return ResponseEntity.ok(ApiResponse.success("Seed data initialized successfully", counts));
    }
}
