package personal.studio.reservation.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.studio.common.dto.ApiResponse;
import personal.studio.common.dto.HealthCheckResponse;
import personal.studio.common.health.HealthCheckService;

import javax.sql.DataSource;

/**
 * Health Check API Controller
 * 예약 서비스와 데이터베이스 연결 상태를 확인한다. (인증 불필요)
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthCheckController {

    private final DataSource dataSource;
    private final HealthCheckService healthCheckService;

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        log.debug("Health check requested");

        HealthCheckResponse data = new HealthCheckResponse(healthCheckService.checkDatabase(dataSource));

        if ("UP".equals(data.database())) {
            return ResponseEntity.ok(ApiResponse.success("Application is healthy", data));
        }
        return ResponseEntity.ok(ApiResponse.error("Database is unreachable", data));
    }
}
