package personal.studio.reservation.booking.application.port.in;

import personal.studio.reservation.booking.domain.model.Booking;
import personal.studio.reservation.user.domain.model.User;

import java.util.List;

/**
 * Get Bookings UseCase (Input Port)
 * 예약 조회 유스케이스
 */
public interface GetBookingsUseCase {

    /**
     * 예약 목록 조회
     * 일반 사용자는 본인 예약만, 운영자는 전체 예약을 이메일/상태로 필터링해 조회한다.
     *
     * @param requester 요청자
     * @param email     예약자 이메일 필터 (운영자만 적용, null 허용)
     * @param status    상태 필터 (대소문자 무시, null 허용)
     * @return 최근 예약 순 목록
     */
    List<Booking> getBookings(User requester, String email, String status);

    /**
     * 예약 단건 조회 (소유자 또는 운영자)
     */
    Booking getBooking(User requester, Long bookingId);
}
