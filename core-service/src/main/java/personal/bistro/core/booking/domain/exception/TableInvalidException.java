package personal.bistro.core.booking.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

/**
 * 예약 요청의 테이블 목록이 비었거나, 중복되거나, 존재하지 않거나, 비활성일 때 발생
 */
public class TableInvalidException extends BusinessException {
    public TableInvalidException(String detail) {
        super(ErrorCode.TABLE_INVALID, detail);
    }

    public static TableInvalidException notFound(int tableNumber) {
        return new TableInvalidException(String.format("Table does not exist: %d", tableNumber));
    }

    public static TableInvalidException missingNumber() {
        return new TableInvalidException("Table number cannot be null");
    }

    public static TableInvalidException inactive(int tableNumber) {
        return new TableInvalidException(String.format("Table is not active: %d", tableNumber));
    }
}
