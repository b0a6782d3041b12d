package personal.studio.reservation.booking.application.port.in;

/**
 * Cancel Booking UseCase (Input Port)
 * 예약 취소 유스케이스
 */
public interface CancelBookingUseCase {

    /**
     * 예약 취소
     *
     * @param command 취소 커맨드 (actor, bookingId)
     * @return 취소했으면 true, 이미 취소된 예약이면 false
     * @throws personal.studio.reservation.booking.domain.exception.BookingNotFoundException 예약을 찾을 수 없을 때
     * @throws personal.studio.reservation.booking.domain.exception.BookingAccessDeniedException 소유자도 운영자도 아닐 때 (403)
     * @throws personal.studio.reservation.booking.domain.exception.StorageException 트랜잭션을 완료하지 못했을 때 (503)
     */
    boolean cancelBooking(CancelBookingCommand command);
}
