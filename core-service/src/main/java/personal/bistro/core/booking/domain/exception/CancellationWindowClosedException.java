package personal.bistro.core.booking.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

/**
 * 사용자가 취소 가능 시간(시작 N시간 전)을 지나 취소하려 할 때 발생
 */
public class CancellationWindowClosedException extends BusinessException {
    public CancellationWindowClosedException(Long reservationId, long windowHours) {
        super(ErrorCode.CANCELLATION_WINDOW_CLOSED,
                String.format("Reservation %d can only be cancelled at least %d hours in advance",
                        reservationId, windowHours));
    }
}
