package personal.bistro.core.booking.application.port.in;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;
import personal.bistro.core.booking.domain.model.BookingRequest;

import java.time.LocalDate;
import java.util.List;

/**
 * Create Reservation Command
 * 예약 생성 커맨드
 */
public record CreateReservationCommand(
        Long userId,
        LocalDate date,
        int slot,
        int guests,
        List<Integer> tableNumbers,
        String contactPhone,
        String specialRequest
) {
    public CreateReservationCommand {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation date cannot be null");
        }
        tableNumbers = BookingRequest.copyTableNumbers(tableNumbers);
    }

    public BookingRequest toBookingRequest() {
        return new BookingRequest(date, slot, guests, tableNumbers);
    }
}
