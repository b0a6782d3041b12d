package personal.studio.reservation.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import personal.studio.reservation.booking.application.port.in.CreateBookingCommand;

/**
 * 수업 예약 요청 DTO
 */
public record CreateBookingRequest(
        @NotNull(message = "수업 ID는 필수입니다.")
        Long classId
) {
    public CreateBookingCommand toCommand(Long userId) {
        return new CreateBookingCommand(userId, classId);
    }
}
