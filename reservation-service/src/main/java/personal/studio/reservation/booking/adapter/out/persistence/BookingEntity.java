package personal.studio.reservation.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.studio.reservation.booking.domain.model.Booking;
import personal.studio.reservation.booking.domain.model.BookingStatus;

import java.time.LocalDateTime;

/**
 * Booking JPA Entity
 * 예약 테이블 매핑
 * <p>
 * (user_id, class_id, CONFIRMED) 유일성은 부분 유니크 인덱스를 JPA로 표현할 수 없으므로
 * 예약 엔진이 수업 행 락을 잡은 트랜잭션 안에서 검사한다.
 */
@Entity
@Table(name = "bookings",
        indexes = {
                @Index(name = "idx_user_class_status", columnList = "user_id, class_id, status"),
                @Index(name = "idx_class_status", columnList = "class_id, status"),
                @Index(name = "idx_booked_at", columnList = "booked_at"),
                @Index(name = "idx_status", columnList = "status")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "class_id", nullable = false)
    private Long classId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "booked_at", nullable = false, updatable = false)
    private LocalDateTime bookedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    /**
     * 도메인 모델로부터 엔티티 생성
     */
    public static BookingEntity fromDomain(Booking booking) {
        BookingEntity entity = new BookingEntity();
        entity.id = booking.id();
        entity.userId = booking.userId();
        entity.classId = booking.classId();
        entity.status = booking.status();
        entity.bookedAt = booking.bookedAt();
        entity.cancelledAt = booking.cancelledAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (bookedAt == null) {
            bookedAt = LocalDateTime.now();
        }
    }

    /**
     * 도메인 모델로 변환
     */
    public Booking toDomain() {
        return new Booking(id, userId, classId, status, bookedAt, cancelledAt);
    }
}
