package personal.studio.reservation.user.application.port.in;

import personal.studio.reservation.user.domain.model.User;

import java.util.Optional;

/**
 * Get User UseCase (Input Port)
 * 사용자 조회 유스케이스
 */
public interface GetUserUseCase {

    /**
     * 이메일로 사용자 조회
     * 운영자의 예약 목록 필터링에 사용하며, 없는 이메일은 빈 결과로 취급한다.
     *
     * @param email 이메일
     * @return 사용자 정보 (없으면 Optional.empty())
     */
    Optional<User> findUserByEmail(String email);
}
