package personal.bistro.core.booking.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

/**
 * 인원 수가 허용 범위를 벗어났을 때 발생
 */
public class InvalidGuestCountException extends BusinessException {
    public InvalidGuestCountException(int guests, int maxGuests) {
        super(ErrorCode.INVALID_GUEST_COUNT,
                String.format("Guest count must be between 1 and %d: %d", maxGuests, guests));
    }
}
