package personal.bistro.core.booking.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

/**
 * 사용자가 변경 가능 시간을 지나 예약을 변경하려 할 때 발생
 */
public class ModificationWindowClosedException extends BusinessException {
    public ModificationWindowClosedException(String detail) {
        super(ErrorCode.MODIFICATION_WINDOW_CLOSED, detail);
    }
}
