package personal.bistro.core.table.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

/**
 * Table Not Found Exception
 * 테이블을 찾을 수 없을 때 발생하는 예외
 */
public class TableNotFoundException extends BusinessException {
    public TableNotFoundException(int tableNumber) {
        super(ErrorCode.TABLE_NOT_FOUND, String.format("Table not found: tableNumber=%d", tableNumber));
    }
}
