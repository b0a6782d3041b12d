package personal.studio.reservation.user.domain.model;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

/**
 * User Domain Model
 * 요청 주체(principal). 예약 소유자 또는 운영자(administrator)
 */
public record User(
        Long id,
        String name,
        String email,
        boolean administrator
) {
    public User {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User name cannot be null or blank");
        }
        if (email == null || email.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User email cannot be null or blank");
        }
    }

    /**
     * 운영자 권한 검증
     *
     * @throws BusinessException 운영자가 아닐 때 (FORBIDDEN)
     */
    public void ensureAdministrator() {
        if (!administrator) {
            throw new BusinessException(ErrorCode.FORBIDDEN,
                    String.format("Administrator role required: userId=%d", id));
        }
    }
}
