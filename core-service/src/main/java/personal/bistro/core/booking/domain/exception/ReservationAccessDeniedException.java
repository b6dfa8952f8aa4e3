package personal.bistro.core.booking.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

/**
 * Reservation Access Denied Exception
 * 다른 사용자의 예약에 접근하려 할 때 발생
 */
public class ReservationAccessDeniedException extends BusinessException {
    public ReservationAccessDeniedException(Long reservationId, Long userId) {
        super(ErrorCode.FORBIDDEN,
                String.format("User %d has no access to reservation %d", userId, reservationId));
    }
}
