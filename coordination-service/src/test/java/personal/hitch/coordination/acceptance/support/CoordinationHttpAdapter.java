package personal.hitch.coordination.acceptance.support;

import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import io.restassured.response.Response;
import io.restassured.specification.RequestSpecification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Coordination Service HTTP Adapter
 * 인수 테스트용 순수 HTTP 클라이언트
 * Environment를 통해 런타임에 포트를 가져옴 (lazy initialization)
 */
@Slf4j
@Component
public class CoordinationHttpAdapter {

    private static final String BASE_URI = "http://localhost";
    private final Environment environment;

    public CoordinationHttpAdapter(Environment environment) {
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

    private RequestSpecification givenUser(Long userId) {
        return givenRequest().header("X-User-Id", userId);
    }

    // ==========================================
    // 좌석 예약 API
    // ==========================================

    public Response reserveSeat(Long rideId, Long passengerId, int seats) {
        log.debug(">>> HTTP: POST /rides/{}/bookings - passengerId={}, seats={}", rideId, passengerId, seats);
        return givenUser(passengerId)
                .body(Map.of("seats", seats))
                .when()
                .post("/api/v1/rides/{rideId}/bookings", rideId);
    }

    public Response confirmBooking(Long bookingId, Long driverId) {
        log.debug(">>> HTTP: POST /bookings/{}/confirm - driverId={}", bookingId, driverId);
        return givenUser(driverId)
                .when()
                .post("/api/v1/bookings/{bookingId}/confirm", bookingId);
    }

    public Response cancelBooking(Long bookingId, Long requesterId) {
        log.debug(">>> HTTP: POST /bookings/{}/cancel - requesterId={}", bookingId, requesterId);
        return givenUser(requesterId)
                .when()
                .post("/api/v1/bookings/{bookingId}/cancel", bookingId);
    }

    public Response getSeats(Long rideId) {
        return givenRequest()
                .when()
                .get("/api/v1/rides/{rideId}/seats", rideId);
    }

    // ==========================================
    // 배송 API
    // ==========================================

    public Response acceptDelivery(Long deliveryId, Long courierId) {
        log.debug(">>> HTTP: POST /deliveries/{}/accept - courierId={}", deliveryId, courierId);
        return givenUser(courierId)
                .when()
                .post("/api/v1/deliveries/{deliveryId}/accept", deliveryId);
    }

    public Response cancelAssignment(Long deliveryId, Long courierId) {
        log.debug(">>> HTTP: POST /deliveries/{}/cancel-assignment - courierId={}", deliveryId, courierId);
        return givenUser(courierId)
                .when()
                .post("/api/v1/deliveries/{deliveryId}/cancel-assignment", deliveryId);
    }

    // ==========================================
    // 에스크로 API
    // ==========================================

    public Response createEscrow(Long payerId, BigDecimal amount, String currency, String subjectType, Long subjectId) {
        log.debug(">>> HTTP: POST /escrows - payerId={}, amount={}", payerId, amount);
        return givenUser(payerId)
                .body(Map.of(
                        "amount", amount,
                        "currency", currency,
                        "subjectType", subjectType,
                        "subjectId", subjectId))
                .when()
                .post("/api/v1/escrows");
    }

    public Response getEscrow(Long escrowId) {
        return givenRequest()
                .when()
                .get("/api/v1/escrows/{escrowId}", escrowId);
    }

    /**
     * 본문 없는 상태 전이 (fund, release, refund)
     */
    public Response transitEscrow(Long escrowId, String action, Long userId) {
        log.debug(">>> HTTP: POST /escrows/{}/{} - userId={}", escrowId, action, userId);
        return givenUser(userId)
                .when()
                .post("/api/v1/escrows/{escrowId}/{action}", escrowId, action);
    }

    public Response disputeEscrow(Long escrowId, Long userId, String reason) {
        return givenUser(userId)
                .body(Map.of("reason", reason))
                .when()
                .post("/api/v1/escrows/{escrowId}/dispute", escrowId);
    }

    public Response resolveDispute(Long escrowId, String outcome) {
        return givenRequest()
                .body(Map.of("outcome", outcome))
                .when()
                .post("/api/v1/escrows/{escrowId}/resolve", escrowId);
    }

    // ==========================================
    // 알림 API
    // ==========================================

    public Response recentNotifications(Long userId) {
        return givenUser(userId)
                .when()
                .get("/api/v1/users/{userId}/notifications", userId);
    }
}
