package personal.bistro.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import personal.bistro.core.auth.Requester;
import personal.bistro.core.booking.application.port.in.UpdateReservationCommand;

import java.time.LocalDate;
import java.util.List;

/**
 * 예약 변경 요청 DTO (부분 수정)
 * notes 는 관리자 API 에서만 반영된다.
 */
public record UpdateReservationRequest(
        LocalDate date,
        Integer slot,
        Integer guests,
        List<@NotNull(message = "테이블 번호는 비어 있을 수 없습니다.") Integer> tableNumbers,
        String contactPhone,
        String specialRequest,
        String notes
) {
    public UpdateReservationCommand toCommand(Long reservationId, Requester requester) {
        return new UpdateReservationCommand(reservationId, requester, date, slot, guests, tableNumbers,
                contactPhone, specialRequest, requester.admin() ? notes : null);
    }
}
