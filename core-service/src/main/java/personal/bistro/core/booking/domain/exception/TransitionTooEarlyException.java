package personal.bistro.core.booking.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;
import personal.bistro.core.booking.domain.model.ReservationStatus;

import java.time.LocalDateTime;

/**
 * 예약 시작 시각 이전에 착석/노쇼/완료 처리할 때 발생
 */
public class TransitionTooEarlyException extends BusinessException {
    public TransitionTooEarlyException(Long reservationId, ReservationStatus target, LocalDateTime startAt) {
        super(ErrorCode.TRANSITION_TOO_EARLY,
                String.format("Reservation %d cannot become %s before %s", reservationId, target, startAt));
    }
}
