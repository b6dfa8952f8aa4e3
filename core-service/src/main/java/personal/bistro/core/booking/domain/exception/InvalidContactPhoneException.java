package personal.bistro.core.booking.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

/**
 * 연락처가 숫자 10자리가 아닐 때 발생
 */
public class InvalidContactPhoneException extends BusinessException {
    public InvalidContactPhoneException(String contactPhone) {
        super(ErrorCode.INVALID_CONTACT_PHONE,
                String.format("Contact phone must be exactly 10 digits: %s", contactPhone));
    }
}
