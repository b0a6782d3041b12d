package personal.studio.reservation.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * 요청자의 X-Timezone 헤더를 ZoneId로 변환
 * 헤더가 없거나 알 수 없는 시간대면 reservation.default-time-zone을 사용한다.
 */
@Slf4j
@Component
public class CallerTimeZoneResolver {

    public static final String TIME_ZONE_HEADER = "X-Timezone";

    private final ZoneId defaultZone;

    public CallerTimeZoneResolver(ReservationProperties reservationProperties) {
        this.defaultZone = ZoneId.of(reservationProperties.defaultTimeZone());
    }

    public ZoneId resolve(String timeZone) {
        if (timeZone == null || timeZone.isBlank()) {
            return defaultZone;
        }
        try {
            return ZoneId.of(timeZone.trim());
        } catch (DateTimeException e) {
            log.warn("Invalid time zone header: {}, falling back to {}", timeZone, defaultZone);
            return defaultZone;
        }
    }
}
