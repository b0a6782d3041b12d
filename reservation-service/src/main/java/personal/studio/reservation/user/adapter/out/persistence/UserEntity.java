package personal.studio.reservation.user.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.studio.reservation.user.domain.model.User;

import java.time.LocalDateTime;

/**
 * User JPA Entity
 * 사용자 테이블 매핑
 */
@Entity
@Table(name = "users")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class UserEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, unique = true, length = 100)
    private String email;

    @Column(nullable = false)
    private boolean administrator;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 정적 팩토리 메서드 (시드 데이터/테스트용)
     */
    public static UserEntity of(String name, String email, boolean administrator) {
        UserEntity entity = new UserEntity();
        entity.name = name;
        entity.email = email;
        entity.administrator = administrator;
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * 도메인 모델로 변환
     */
    public User toDomain() {
        return new User(id, name, email, administrator);
    }
}
