package personal.bistro.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import personal.bistro.core.booking.domain.model.ReservationStatus;

/**
 * 예약 상태 변경 요청 DTO
 */
public record ChangeStatusRequest(
        @NotNull(message = "변경할 상태는 필수입니다.")
        ReservationStatus status
) {
}
