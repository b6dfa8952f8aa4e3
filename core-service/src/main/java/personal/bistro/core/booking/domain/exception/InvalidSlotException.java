package personal.bistro.core.booking.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

/**
 * 슬롯 번호가 1~15 범위를 벗어났을 때 발생
 */
public class InvalidSlotException extends BusinessException {
    public InvalidSlotException(int slot) {
        super(ErrorCode.INVALID_SLOT, String.format("Invalid time slot: %d", slot));
    }
}
