package personal.studio.reservation.booking.application.port.out;

import personal.studio.reservation.booking.domain.model.Booking;
import personal.studio.reservation.booking.domain.model.BookingStatus;

import java.util.List;
import java.util.Optional;

/**
 * Booking Repository (Output Port)
 * 예약 저장소 인터페이스
 */
public interface BookingRepository {

    /**
     * 예약 저장 (생성 또는 상태 변경)
     *
     * @param booking 예약 정보
     * @return 저장된 예약 정보 (ID 포함)
     */
    Booking save(Booking booking);

    /**
     * 예약 ID로 조회
     *
     * @param bookingId 예약 ID
     * @return 예약 정보
     */
    Optional<Booking> findById(Long bookingId);

    /**
     * 예약 상태만 저장소에서 다시 읽는다. (영속성 컨텍스트 캐시를 거치지 않음)
     * 수업 행 락을 잡은 뒤 상태를 재확인할 때 사용한다.
     *
     * @param bookingId 예약 ID
     * @return 현재 커밋된 예약 상태
     */
    Optional<BookingStatus> findCurrentStatus(Long bookingId);

    /**
     * 사용자의 해당 수업 CONFIRMED 예약 존재 여부
     *
     * @param userId  사용자 ID
     * @param classId 수업 ID
     * @return 존재 여부
     */
    boolean existsConfirmed(Long userId, Long classId);

    /**
     * 수업의 CONFIRMED 예약 수
     *
     * @param classId 수업 ID
     * @return 확정 예약 수
     */
    long countConfirmed(Long classId);

    /**
     * 사용자의 예약 목록 (최근 예약 순)
     *
     * @param userId 사용자 ID
     * @param status 상태 필터 (null이면 전체)
     */
    List<Booking> findByUser(Long userId, BookingStatus status);

    /**
     * 전체 예약 목록 (최근 예약 순, 운영자용)
     *
     * @param status 상태 필터 (null이면 전체)
     */
    List<Booking> findAll(BookingStatus status);
}
