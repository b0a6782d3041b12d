package personal.studio.reservation.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.studio.common.dto.ApiResponse;
import personal.studio.reservation.booking.adapter.in.web.dto.BookingResponse;
import personal.studio.reservation.booking.adapter.in.web.dto.CreateBookingRequest;
import personal.studio.reservation.booking.application.port.in.CancelBookingCommand;
import personal.studio.reservation.booking.application.port.in.CancelBookingUseCase;
import personal.studio.reservation.booking.application.port.in.CreateBookingUseCase;
import personal.studio.reservation.booking.application.port.in.GetBookingsUseCase;
import personal.studio.reservation.booking.domain.model.Booking;
import personal.studio.reservation.user.application.port.in.ValidateUserUseCase;
import personal.studio.reservation.user.domain.model.User;

import java.util.List;

/**
 * Booking API Controller
 * 수업 예약 생성/취소/조회 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final CreateBookingUseCase createBookingUseCase;
    private final CancelBookingUseCase cancelBookingUseCase;
    private final GetBookingsUseCase getBookingsUseCase;
    private final ValidateUserUseCase validateUserUseCase;

    /**
     * 수업 예약
     * POST /api/v1/bookings
     */
    @PostMapping
    public ResponseEntity<ApiResponse<BookingResponse>> createBooking(
            @Valid @RequestBody CreateBookingRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Create booking: userId={}, classId={}", userId, request.classId());

        User user = validateUserUseCase.validateUser(userId);
        Booking booking = createBookingUseCase.createBooking(request.toCommand(user.id()));

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Booking confirmed", BookingResponse.from(booking)));
    }

    /**
     * 예약 취소
     * POST /api/v1/bookings/{bookingId}/cancel
     * 이미 취소된 예약이면 상태 변경 없이 400을 반환한다.
     */
    @PostMapping("/{bookingId}/cancel")
    public ResponseEntity<ApiResponse<Void>> cancelBooking(
            @PathVariable Long bookingId,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Cancel booking: bookingId={}, userId={}", bookingId, userId);

        User actor = validateUserUseCase.validateUser(userId);
        boolean cancelled = cancelBookingUseCase.cancelBooking(new CancelBookingCommand(actor, bookingId));

        if (!cancelled) {
            return ResponseEntity.badRequest()
                    .body(ApiResponse.error("Booking is already cancelled or not confirmed"));
        }
        return ResponseEntity.ok(ApiResponse.success("Booking cancelled"));
    }

    /**
     * 예약 목록 조회
     * GET /api/v1/bookings?email=&status=
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<BookingResponse>>> getBookings(
            @RequestHeader("X-User-Id") Long userId,
            @RequestParam(required = false) String email,
            @RequestParam(required = false) String status
    ) {
        User requester = validateUserUseCase.validateUser(userId);

        List<BookingResponse> response = getBookingsUseCase.getBookings(requester, email, status).stream()
                .map(BookingResponse::from)
                .toList();

        return ResponseEntity.ok(ApiResponse.success("Bookings retrieved", response));
    }

    /**
     * 예약 단건 조회
     * GET /api/v1/bookings/{bookingId}
     */
    @GetMapping("/{bookingId}")
    public ResponseEntity<ApiResponse<BookingResponse>> getBooking(
            @PathVariable Long bookingId,
            @RequestHeader("X-User-Id") Long userId
    ) {
        User requester = validateUserUseCase.validateUser(userId);
        Booking booking = getBookingsUseCase.getBooking(requester, bookingId);

        return ResponseEntity.ok(ApiResponse.success("Booking retrieved", BookingResponse.from(booking)));
    }
}
