package personal.studio.reservation.admin.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Seed Data Initialization Service
 *
 * 데모용 사용자/수업/예약 데이터 생성
 * availableSlots는 확정 예약 수만큼 차감된 값으로 넣는다. (totalSlots = available + confirmed)
 *
 * WARNING: 개발/테스트 전용 - 기존 데이터를 모두 삭제한다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeedDataInitService {

    private final JdbcTemplate jdbcTemplate;

    /**
     * 시드 데이터 초기화
     *
     * @return 생성된 데이터 개수 (users, classes, bookings)
     */
    @Transactional
    public Map<String, Long> initializeSeedData() {
        log.info("Starting seed data initialization...");

        cleanupExistingData();

        LocalDateTime now = LocalDateTime.now();

        createUser("Super Admin", "superadmin@test.com", true);
        createUser("Admin", "admin@test.com", true);
        long user1 = createUser("User One", "user1@test.com", false);
        long user2 = createUser("User Two", "user2@test.com", false);

        // 예정 수업 2개, 지난 수업 2개 (통계 확인용)
        long yoga = createClass("Sunrise Yoga", "YOGA", "Alice", 60, now.plusDays(2), 10, 9);
        long zumba = createClass("Evening Zumba", "ZUMBA", "Bob", 45, now.plusDays(1), 15, 13);
        long hiit = createClass("HIIT Blast", "HIIT", "Charlie", 30, now.minusDays(10), 20, 20);
        long stretch = createClass("Recent Stretch", "YOGA", "Dana", 50, now.minusDays(5), 10, 9);

        createBooking(user1, yoga, "CONFIRMED", now);
        createBooking(user2, yoga, "CANCELLED", now);
        createBooking(user1, zumba, "CONFIRMED", now);
        createBooking(user2, zumba, "CONFIRMED", now);
        createBooking(user1, hiit, "CANCELLED", now);
        createBooking(user2, stretch, "CONFIRMED", now);

        log.info("Seed data initialization completed - Users: 4, Classes: 4, Bookings: 6");

        return Map.of(
                "users", 4L,
                "classes", 4L,
                "bookings", 6L
        );
    }

    private void cleanupExistingData() {
        log.debug("Cleaning up existing data...");

        jdbcTemplate.update("DELETE FROM bookings");
        jdbcTemplate.update("DELETE FROM class_sessions");
        jdbcTemplate.update("DELETE FROM users");

        log.debug("Existing data cleaned up");
    }

    private long createUser(String name, String email, boolean administrator) {
        LocalDateTime now = LocalDateTime.now();
        Map<String, Object> row = new HashMap<>();
        row.put("name", name);
        row.put("email", email);
        row.put("administrator", administrator);
        row.put("created_at", now);
        row.put("updated_at", now);

        long id = insert("users", row);
        log.debug("User created - id: {}, email: {}", id, email);
        return id;
    }

    private long createClass(String name, String category, String instructor, int durationMinutes,
                             LocalDateTime startTime, int totalSlots, int availableSlots) {
        LocalDateTime now = LocalDateTime.now();
        Map<String, Object> row = new HashMap<>();
        row.put("name", name);
        row.put("category", category);
        row.put("instructor", instructor);
        row.put("start_time", startTime);
        row.put("duration_minutes", durationMinutes);
        row.put("total_slots", totalSlots);
        row.put("available_slots", availableSlots);
        row.put("created_at", now);
        row.put("updated_at", now);

        long id = insert("class_sessions", row);
        log.debug("Class created - id: {}, name: {}", id, name);
        return id;
    }

    private void createBooking(long userId, long classId, String status, LocalDateTime now) {
        Map<String, Object> row = new HashMap<>();
        row.put("user_id", userId);
        row.put("class_id", classId);
        row.put("status", status);
        row.put("booked_at", now);
        row.put("cancelled_at", "CANCELLED".equals(status) ? now : null);

        insert("bookings", row);
    }

    private long insert(String table, Map<String, Object> row) {
        return new SimpleJdbcInsert(jdbcTemplate)
                .withTableName(table)
                .usingColumns(row.keySet().toArray(String[]::new))
                .usingGeneratedKeyColumns("id")
                .executeAndReturnKey(row)
                .longValue();
    }
}
