package personal.studio.reservation.acceptance.support;

import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import io.restassured.response.Response;
import io.restassured.specification.RequestSpecification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Reservation Service HTTP Adapter
 * 인수 테스트용 순수 HTTP 클라이언트
 * Environment를 통해 런타임에 포트를 가져옴 (lazy initialization)
 */
@Slf4j
public class ReservationHttpAdapter {

    private static final String BASE_URI = "http://localhost";
    private final Environment environment;

    public ReservationHttpAdapter(Environment environment) {
        this.environment = environment;
    }

    private int getPort() {
        return environment.getProperty("local.server.port", Integer.class, 8080);
    }

    private RequestSpecification givenRequest() {
        return RestAssured.given()
                .baseUri(BASE_URI)
                .port(getPort())
                .contentType(ContentType.JSON);
    }

    private RequestSpecification givenRequestAs(Long userId) {
        return givenRequest().header("X-User-Id", userId);
    }

    // ==========================================
    // 운영자 API
    // ==========================================

    /**
     * 시드 데이터 초기화
     * POST /api/admin/seed-data
     */
    public Response initializeSeedData() {
        log.debug(">>> HTTP: POST /api/admin/seed-data");
        return givenRequest()
                .when()
                .post("/api/admin/seed-data");
    }

    /**
     * 수업 등록
     * POST /api/v1/admin/classes
     */
    public Response createClass(Long adminId, String name, LocalDateTime startTime, int totalSlots) {
        log.debug(">>> HTTP: POST /admin/classes - name={}, totalSlots={}", name, totalSlots);
        return givenRequestAs(adminId)
                .body(classBody(name, startTime, totalSlots))
                .when()
                .post("/api/v1/admin/classes");
    }

    /**
     * 수업 수정
     * PUT /api/v1/admin/classes/{classId}
     */
    public Response updateClass(Long adminId, Long classId, String name, LocalDateTime startTime, int totalSlots) {
        log.debug(">>> HTTP: PUT /admin/classes/{} - totalSlots={}", classId, totalSlots);
        return givenRequestAs(adminId)
                .body(classBody(name, startTime, totalSlots))
                .when()
                .put("/api/v1/admin/classes/{classId}", classId);
    }

    /**
     * 수업 삭제
     * DELETE /api/v1/admin/classes/{classId}
     */
    public Response deleteClass(Long adminId, Long classId) {
        log.debug(">>> HTTP: DELETE /admin/classes/{}", classId);
        return givenRequestAs(adminId)
                .when()
                .delete("/api/v1/admin/classes/{classId}", classId);
    }

    // ==========================================
    // 수업 API
    // ==========================================

    /**
     * 수업 상세 조회
     * GET /api/v1/classes/{classId}
     */
    public Response getClass(Long userId, Long classId) {
        return givenRequestAs(userId)
                .when()
                .get("/api/v1/classes/{classId}", classId);
    }

    // ==========================================
    // 예약 API
    // ==========================================

    /**
     * 예약 생성
     * POST /api/v1/bookings
     */
    public Response createBooking(Long userId, Long classId) {
        log.debug(">>> HTTP: POST /bookings - userId={}, classId={}", userId, classId);
        return givenRequestAs(userId)
                .body(Map.of("classId", classId))
                .when()
                .post("/api/v1/bookings");
    }

    /**
     * 헤더 없이 예약 생성
     */
    public Response createBookingAnonymously(Long classId) {
        return givenRequest()
                .body(Map.of("classId", classId))
                .when()
                .post("/api/v1/bookings");
    }

    /**
     * 예약 취소
     * POST /api/v1/bookings/{bookingId}/cancel
     */
    public Response cancelBooking(Long userId, Long bookingId) {
        log.debug(">>> HTTP: POST /bookings/{}/cancel - userId={}", bookingId, userId);
        return givenRequestAs(userId)
                .when()
                .post("/api/v1/bookings/{bookingId}/cancel", bookingId);
    }

    /**
     * 예약 상세 조회
     * GET /api/v1/bookings/{bookingId}
     */
    public Response getBooking(Long userId, Long bookingId) {
        return givenRequestAs(userId)
                .when()
                .get("/api/v1/bookings/{bookingId}", bookingId);
    }

    /**
     * 내 통계 조회
     * GET /api/v1/users/me/statistics
     */
    public Response getMyStatistics(Long userId) {
        return givenRequestAs(userId)
                .when()
                .get("/api/v1/users/me/statistics");
    }

    private Map<String, Object> classBody(String name, LocalDateTime startTime, int totalSlots) {
        Map<String, Object> body = new HashMap<>();
        body.put("name", name);
        body.put("category", "YOGA");
        body.put("instructor", "Alice");
        body.put("startTime", startTime.toString());
        body.put("durationMinutes", 60);
        body.put("totalSlots", totalSlots);
        return body;
    }
}
