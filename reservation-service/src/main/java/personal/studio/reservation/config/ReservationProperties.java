package personal.studio.reservation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Reservation 설정 Properties
 * application.yml의 reservation.* 설정을 바인딩
 */
@ConfigurationProperties(prefix = "reservation")
public record ReservationProperties(
        Statistics statistics,
        String defaultTimeZone     // X-Timezone 헤더가 없거나 잘못됐을 때 사용할 시간대
) {
    public record Statistics(
            int windowDays,            // 운영자 통계 집계 기간 (일)
            int popularClassLimit,
            int upcomingPreviewLimit
    ) {}
}
