package personal.bistro.core.booking.domain.model;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;
import personal.bistro.core.booking.domain.exception.InvalidContactPhoneException;

import java.util.regex.Pattern;

/**
 * 예약 부가 정보
 *
 * @param contactPhone   연락처 (숫자 10자리)
 * @param specialRequest 고객 요청사항 (최대 200자)
 * @param notes          관리자 메모 (최대 300자)
 */
public record ReservationDetails(
        String contactPhone,
        String specialRequest,
        String notes
) {
    public static final int MAX_SPECIAL_REQUEST_LENGTH = 200;
    public static final int MAX_NOTES_LENGTH = 300;

    private static final Pattern PHONE_PATTERN = Pattern.compile("^[0-9]{10}$");

    public ReservationDetails {
        if (contactPhone == null || !PHONE_PATTERN.matcher(contactPhone).matches()) {
            throw new InvalidContactPhoneException(contactPhone);
        }
        if (specialRequest != null && specialRequest.length() > MAX_SPECIAL_REQUEST_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Special request cannot exceed %d characters", MAX_SPECIAL_REQUEST_LENGTH));
        }
        if (notes != null && notes.length() > MAX_NOTES_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Notes cannot exceed %d characters", MAX_NOTES_LENGTH));
        }
    }

    /**
     * null 인 항목은 기존 값을 유지한다.
     */
    public ReservationDetails merge(String newContactPhone, String newSpecialRequest, String newNotes) {
        return new ReservationDetails(
                newContactPhone != null ? newContactPhone : contactPhone,
                newSpecialRequest != null ? newSpecialRequest : specialRequest,
                newNotes != null ? newNotes : notes);
    }
}
