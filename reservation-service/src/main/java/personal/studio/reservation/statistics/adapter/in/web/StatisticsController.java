package personal.studio.reservation.statistics.adapter.in.web;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.studio.common.dto.ApiResponse;
import personal.studio.reservation.statistics.adapter.in.web.dto.StudioStatisticsResponse;
import personal.studio.reservation.statistics.adapter.in.web.dto.UserStatisticsResponse;
import personal.studio.reservation.statistics.application.port.in.GetStatisticsUseCase;
import personal.studio.reservation.user.application.port.in.ValidateUserUseCase;
import personal.studio.reservation.user.domain.model.User;

/**
 * Statistics API Controller
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class StatisticsController {

    private final GetStatisticsUseCase getStatisticsUseCase;
    private final ValidateUserUseCase validateUserUseCase;

    /**
     * 운영자 통계
     * GET /api/v1/admin/statistics
     */
    @GetMapping("/admin/statistics")
    public ResponseEntity<ApiResponse<StudioStatisticsResponse>> getStudioStatistics(
            @RequestHeader("X-User-Id") Long userId
    ) {
        User requester = validateUserUseCase.validateUser(userId);
        StudioStatisticsResponse response = StudioStatisticsResponse.from(
                getStatisticsUseCase.getStudioStatistics(requester));
        return ResponseEntity.ok(ApiResponse.success("Statistics retrieved", response));
    }

    /**
     * 내 예약 통계
     * GET /api/v1/users/me/statistics
     */
    @GetMapping("/users/me/statistics")
    public ResponseEntity<ApiResponse<UserStatisticsResponse>> getMyStatistics(
            @RequestHeader("X-User-Id") Long userId
    ) {
        User requester = validateUserUseCase.validateUser(userId);
        UserStatisticsResponse response = UserStatisticsResponse.from(
                getStatisticsUseCase.getUserStatistics(requester));
        return ResponseEntity.ok(ApiResponse.success("Statistics retrieved", response));
    }
}
