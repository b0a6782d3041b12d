package personal.studio.common.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;

/**
 * Health Check 공통 유틸리티 서비스
 * 인프라 컴포넌트의 상태를 확인하는 재사용 가능한 메서드 제공
 */
@Slf4j
@Service
public class HealthCheckService {

    private static final int VALIDATION_TIMEOUT_SECONDS = 1;

    /**
     * 데이터베이스 연결 상태 확인
     * DataSource를 사용하는 서비스에서만 호출 가능
     *
     * @param dataSource the DataSource to check
     * @return "UP" if database is reachable, "DOWN" otherwise
     */
    public String checkDatabase(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(VALIDATION_TIMEOUT_SECONDS) ? "UP" : "DOWN";
        } catch (Exception e) {
            log.error("Database health check failed", e);
            return "DOWN";
        }
    }
}
