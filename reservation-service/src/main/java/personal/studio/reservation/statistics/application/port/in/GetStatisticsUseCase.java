package personal.studio.reservation.statistics.application.port.in;

import personal.studio.reservation.statistics.domain.model.StudioStatistics;
import personal.studio.reservation.statistics.domain.model.UserStatistics;
import personal.studio.reservation.user.domain.model.User;

/**
 * Get Statistics UseCase (Input Port)
 * 통계 조회 유스케이스
 */
public interface GetStatisticsUseCase {

    /**
     * 운영자용 스튜디오 통계 (최근 N일)
     *
     * @throws personal.studio.common.exception.BusinessException 운영자가 아닐 때 (FORBIDDEN)
     */
    StudioStatistics getStudioStatistics(User requester);

    /**
     * 요청자 본인의 예약 통계
     */
    UserStatistics getUserStatistics(User requester);
}
