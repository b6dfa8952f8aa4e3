package personal.bistro.common.exception;

/**
 * 비즈니스 예외의 최상위 타입
 * ErrorCode로 HTTP 상태와 에러 코드를 결정하고, message에는 상세 원인을 담는다.
 */
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
