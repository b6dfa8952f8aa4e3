package personal.bistro.core.booking.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;
import personal.bistro.core.booking.domain.model.ReservationStatus;

/**
 * 허용되지 않은 상태 전이 시 발생 (종료 상태에서의 전이 포함)
 */
public class InvalidTransitionException extends BusinessException {
    public InvalidTransitionException(Long reservationId, ReservationStatus from, ReservationStatus to) {
        super(ErrorCode.INVALID_TRANSITION,
                String.format("Cannot change reservation %d from %s to %s", reservationId, from, to));
    }
}
