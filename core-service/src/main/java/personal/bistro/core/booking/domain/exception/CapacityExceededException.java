package personal.bistro.core.booking.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

/**
 * 선택한 테이블의 좌석 합이 인원 수보다 적을 때 발생
 */
public class CapacityExceededException extends BusinessException {
    public CapacityExceededException(int totalCapacity, int guests) {
        super(ErrorCode.CAPACITY_EXCEEDED,
                String.format("Total capacity %d is less than guest count %d", totalCapacity, guests));
    }
}
