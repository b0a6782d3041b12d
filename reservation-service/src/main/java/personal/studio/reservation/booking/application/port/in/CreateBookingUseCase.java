package personal.studio.reservation.booking.application.port.in;

import personal.studio.reservation.booking.domain.model.Booking;

/**
 * Create Booking UseCase (Input Port)
 * 수업 예약 유스케이스
 */
public interface CreateBookingUseCase {

    /**
     * 수업 좌석 예약
     * 수업 행 락을 잡은 트랜잭션 안에서 검증 후 예약 생성과 좌석 차감을 함께 커밋
     *
     * @param command 예약 커맨드 (userId, classId)
     * @return 생성된 예약 정보 (CONFIRMED)
     * @throws personal.studio.reservation.catalog.domain.exception.ClassSessionNotFoundException 수업을 찾을 수 없을 때
     * @throws personal.studio.reservation.catalog.domain.exception.ClassUnavailableException 시작했거나 좌석이 없을 때 (409)
     * @throws personal.studio.reservation.booking.domain.exception.DuplicateBookingException 이미 예약한 수업일 때 (409)
     * @throws personal.studio.reservation.booking.domain.exception.StorageException 트랜잭션을 완료하지 못했을 때 (503)
     */
    Booking createBooking(CreateBookingCommand command);
}
