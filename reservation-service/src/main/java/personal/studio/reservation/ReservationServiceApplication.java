package personal.studio.reservation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Reservation Service Application
 * 수업 카탈로그, 좌석 예약 엔진, 통계를 포함하는 예약 서비스
 */
@ConfigurationPropertiesScan
@SpringBootApplication(
    scanBasePackages = {
        "personal.studio.reservation",
        "personal.studio.common"  // common 모듈의 GlobalExceptionHandler, MdcFilter 등을 스캔
    }
)
public class ReservationServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReservationServiceApplication.class, args);
    }
}
