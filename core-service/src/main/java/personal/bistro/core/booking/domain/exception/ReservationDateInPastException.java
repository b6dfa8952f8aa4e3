package personal.bistro.core.booking.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * 오늘 이전 날짜로 예약하거나 변경할 때 발생
 */
public class ReservationDateInPastException extends BusinessException {
    public ReservationDateInPastException(LocalDate date, LocalDate today) {
        super(ErrorCode.RESERVATION_DATE_IN_PAST,
                String.format("Reservation date %s is before today %s", date, today));
    }
}
