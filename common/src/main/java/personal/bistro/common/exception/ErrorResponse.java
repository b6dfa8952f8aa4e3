package personal.bistro.common.exception;

/**
 * 에러 응답 포맷
 *
 * @param code    안정적인 에러 코드 (예: "R008")
 * @param message 사용자용 기본 메시지
 * @param detail  상세 원인 (충돌한 테이블 번호 등), 없으면 null
 */
public record ErrorResponse(
        String code,
        String message,
        String detail
) {
    public static ErrorResponse of(ErrorCode errorCode, String detail) {
        return new ErrorResponse(errorCode.getCode(), errorCode.getMessage(), detail);
    }

    public static ErrorResponse of(ErrorCode errorCode) {
        return new ErrorResponse(errorCode.getCode(), errorCode.getMessage(), null);
    }
}
