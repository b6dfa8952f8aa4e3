package personal.bistro.core.booking.application.port.in;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;
import personal.bistro.core.auth.Requester;
import personal.bistro.core.booking.domain.model.BookingRequest;
import personal.bistro.core.booking.domain.model.Reservation;

import java.time.LocalDate;
import java.util.List;

/**
 * Update Reservation Command
 * 부분 수정 - null 인 항목은 기존 값을 유지한다. notes 는 관리자만 수정할 수 있다.
 */
public record UpdateReservationCommand(
        Long reservationId,
        Requester requester,
        LocalDate date,
        Integer slot,
        Integer guests,
        List<Integer> tableNumbers,
        String contactPhone,
        String specialRequest,
        String notes
) {
    public UpdateReservationCommand {
        if (reservationId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation ID cannot be null");
        }
        if (requester == null) {
            throw new BusinessException(ErrorCode.UNAUTHORIZED, "Requester cannot be null");
        }
        tableNumbers = tableNumbers == null ? null : BookingRequest.copyTableNumbers(tableNumbers);
    }

    /**
     * 현재 예약에 변경 사항을 덮어쓴 점유 요청
     */
    public BookingRequest mergeInto(Reservation current) {
        return new BookingRequest(
                date != null ? date : current.date(),
                slot != null ? slot : current.slot(),
                guests != null ? guests : current.guests(),
                tableNumbers != null ? tableNumbers : current.tableNumbers());
    }
}
