package personal.studio.reservation.user.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.studio.reservation.user.application.port.in.GetUserUseCase;
import personal.studio.reservation.user.application.port.in.ValidateUserUseCase;
import personal.studio.reservation.user.application.port.out.UserRepository;
import personal.studio.reservation.user.domain.exception.UserNotFoundException;
import personal.studio.reservation.user.domain.model.User;

import java.util.Optional;

/**
 * User Application Service
 * 사용자 관련 모든 UseCase를 구현하는 Application Service
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UserService implements ValidateUserUseCase, GetUserUseCase {

    private final UserRepository userRepository;

    @Override
    public User validateUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> {
                    log.warn("User not found for validation: userId={}", userId);
                    return new UserNotFoundException(userId);
                });
    }

    @Override
    public Optional<User> findUserByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        Optional<User> user = userRepository.findByEmail(email.trim());
        log.debug("User lookup by email: found={}", user.isPresent());
        return user;
    }
}
