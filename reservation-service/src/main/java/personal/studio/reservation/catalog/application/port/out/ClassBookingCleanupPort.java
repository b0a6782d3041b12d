package personal.studio.reservation.catalog.application.port.out;

/**
 * Class Booking Cleanup Port (Output Port)
 * 수업 삭제 시 해당 수업을 참조하는 예약 이력을 함께 제거한다.
 */
public interface ClassBookingCleanupPort {

    /**
     * 수업의 모든 예약 삭제
     *
     * @param classId 수업 ID
     * @return 삭제된 예약 수
     */
    int deleteAllBookingsOfClass(Long classId);
}
