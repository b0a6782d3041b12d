package personal.studio.reservation.user.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.studio.reservation.user.application.port.out.UserRepository;
import personal.studio.reservation.user.domain.model.User;

import java.util.Optional;

/**
 * User Persistence Adapter
 * JPA를 사용한 사용자 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserPersistenceAdapter implements UserRepository {

    private final JpaUserRepository jpaUserRepository;

    @Override
    public Optional<User> findById(Long userId) {
        log.debug("Finding user by id: {}", userId);
        return jpaUserRepository.findById(userId)
                .map(UserEntity::toDomain);
    }

    @Override
    public Optional<User> findByEmail(String email) {
        log.debug("Finding user by email");
        return jpaUserRepository.findByEmailIgnoreCase(email)
                .map(UserEntity::toDomain);
    }
}
