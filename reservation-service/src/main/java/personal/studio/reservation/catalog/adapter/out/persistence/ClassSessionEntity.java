package personal.studio.reservation.catalog.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.studio.reservation.catalog.domain.model.ClassCategory;
import personal.studio.reservation.catalog.domain.model.ClassSession;

import java.time.LocalDateTime;

/**
 * Class Session JPA Entity
 * 수업 테이블 매핑
 */
@Entity
@Table(name = "class_sessions",
        indexes = {
                @Index(name = "idx_start_time", columnList = "start_time"),
                @Index(name = "idx_category_start_time", columnList = "category, start_time")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ClassSessionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ClassCategory category;

    @Column(nullable = false, length = 100)
    private String instructor;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Column(name = "total_slots", nullable = false)
    private int totalSlots;

    @Column(name = "available_slots", nullable = false)
    private int availableSlots;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 도메인 모델로부터 엔티티 생성
     */
    public static ClassSessionEntity fromDomain(ClassSession classSession) {
        ClassSessionEntity entity = new ClassSessionEntity();
        entity.id = classSession.id();
        entity.name = classSession.name();
        entity.category = classSession.category();
        entity.instructor = classSession.instructor();
        entity.startTime = classSession.startTime();
        entity.durationMinutes = classSession.durationMinutes();
        entity.totalSlots = classSession.totalSlots();
        entity.availableSlots = classSession.availableSlots();
        entity.createdAt = classSession.createdAt();
        entity.updatedAt = classSession.updatedAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * 도메인 모델로 변환
     */
    public ClassSession toDomain() {
        return new ClassSession(id, name, category, instructor, startTime, durationMinutes,
                totalSlots, availableSlots, createdAt, updatedAt);
    }
}
