package personal.bistro.core.booking.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

/**
 * 여유 좌석 제한(인원 + 1)을 넘는 테이블 조합일 때 발생
 */
public class TableOversizedException extends BusinessException {
    public TableOversizedException(String detail) {
        super(ErrorCode.TABLE_OVERSIZED, detail);
    }
}
