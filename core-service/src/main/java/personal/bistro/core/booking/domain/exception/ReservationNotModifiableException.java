package personal.bistro.core.booking.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;
import personal.bistro.core.booking.domain.model.ReservationStatus;

/**
 * CONFIRMED 가 아닌 예약을 수정하려 할 때 발생
 */
public class ReservationNotModifiableException extends BusinessException {
    public ReservationNotModifiableException(Long reservationId, ReservationStatus status) {
        super(ErrorCode.RESERVATION_NOT_MODIFIABLE,
                String.format("Reservation %d cannot be modified in %s status", reservationId, status));
    }
}
