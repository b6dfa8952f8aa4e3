package personal.bistro.core.booking.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

/**
 * Concurrent Reservation Exception
 * 잠금 획득 실패 또는 동시 점유로 인한 유니크 제약 위반 시 발생
 */
public class ConcurrentReservationException extends BusinessException {
    public ConcurrentReservationException(String detail) {
        super(ErrorCode.CONCURRENT_RESERVATION, detail);
    }

    public ConcurrentReservationException(String detail, Throwable cause) {
        super(ErrorCode.CONCURRENT_RESERVATION, detail);
        initCause(cause);
    }
}
