package personal.bistro.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 * 클라이언트는 code 값으로 분기하므로 한 번 공개된 code는 변경하지 않는다.
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "C002", "인증이 필요합니다."),
    FORBIDDEN(HttpStatus.FORBIDDEN, "C003", "권한이 없습니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, "C005", "리소스 충돌이 발생했습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),

    // Table Domain (Txxx)
    TABLE_NOT_FOUND(HttpStatus.NOT_FOUND, "T001", "테이블을 찾을 수 없습니다."),
    TABLE_INVALID(HttpStatus.BAD_REQUEST, "T002", "존재하지 않거나 사용할 수 없는 테이블입니다."),
    INVALID_TABLE_ATTRIBUTE(HttpStatus.BAD_REQUEST, "T003", "테이블 속성이 허용 범위를 벗어났습니다."),

    // Reservation Domain (Rxxx)
    RESERVATION_NOT_FOUND(HttpStatus.NOT_FOUND, "R001", "예약을 찾을 수 없습니다."),
    RESERVATION_DATE_IN_PAST(HttpStatus.BAD_REQUEST, "R002", "지난 날짜로는 예약할 수 없습니다."),
    INVALID_SLOT(HttpStatus.BAD_REQUEST, "R003", "유효하지 않은 예약 시간대입니다."),
    INVALID_GUEST_COUNT(HttpStatus.BAD_REQUEST, "R004", "인원 수가 허용 범위를 벗어났습니다."),
    INVALID_CONTACT_PHONE(HttpStatus.BAD_REQUEST, "R005", "연락처 형식이 올바르지 않습니다."),
    CAPACITY_EXCEEDED(HttpStatus.BAD_REQUEST, "R006", "선택한 테이블의 좌석이 인원 수보다 부족합니다."),
    TABLE_OVERSIZED(HttpStatus.BAD_REQUEST, "R007", "선택한 테이블이 인원 수에 비해 너무 큽니다."),
    SLOT_CONFLICT(HttpStatus.CONFLICT, "R008", "이미 예약된 시간대입니다."),
    CONCURRENT_RESERVATION(HttpStatus.CONFLICT, "R009", "동시 예약 충돌이 발생했습니다. 잠시 후 다시 시도해 주세요."),
    INVALID_TRANSITION(HttpStatus.CONFLICT, "R010", "현재 예약 상태에서 허용되지 않는 상태 변경입니다."),
    RESERVATION_NOT_MODIFIABLE(HttpStatus.BAD_REQUEST, "R011", "확정 상태의 예약만 변경할 수 있습니다."),
    CANCELLATION_WINDOW_CLOSED(HttpStatus.BAD_REQUEST, "R012", "예약 취소 가능 시간이 지났습니다."),
    MODIFICATION_WINDOW_CLOSED(HttpStatus.BAD_REQUEST, "R013", "예약 변경 가능 시간이 지났습니다."),
    TRANSITION_TOO_EARLY(HttpStatus.BAD_REQUEST, "R014", "예약 시간 이전에는 변경할 수 없는 상태입니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
