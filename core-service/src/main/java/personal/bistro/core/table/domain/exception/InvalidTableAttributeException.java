package personal.bistro.core.table.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

/**
 * Invalid Table Attribute Exception
 * 테이블 번호, 수용 인원, 메모 길이가 허용 범위를 벗어났을 때 발생
 */
public class InvalidTableAttributeException extends BusinessException {
    public InvalidTableAttributeException(String detail) {
        super(ErrorCode.INVALID_TABLE_ATTRIBUTE, detail);
    }
}
