package personal.studio.reservation.user.application.port.in;

import personal.studio.reservation.user.domain.model.User;

/**
 * Validate User UseCase (Input Port)
 * X-User-Id 헤더로 전달된 요청 주체를 사용자로 확인한다.
 */
public interface ValidateUserUseCase {

    /**
     * 사용자 ID로 검증
     * @param userId 사용자 ID
     * @return 사용자 정보
     * @throws personal.studio.reservation.user.domain.exception.UserNotFoundException 사용자가 존재하지 않을 때
     */
    User validateUser(Long userId);
}
