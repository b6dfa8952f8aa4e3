package personal.bistro.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import personal.bistro.core.booking.application.port.in.CreateReservationCommand;

import java.time.LocalDate;
import java.util.List;

/**
 * 예약 생성 요청 DTO
 * 필수 여부만 검사하고, 범위/형식 검증은 도메인에서 전용 에러 코드로 수행한다.
 */
public record CreateReservationRequest(
        @NotNull(message = "예약 날짜는 필수입니다.")
        LocalDate date,

        @NotNull(message = "예약 시간대는 필수입니다.")
        Integer slot,

        @NotNull(message = "인원 수는 필수입니다.")
        Integer guests,

        @NotEmpty(message = "테이블을 하나 이상 선택해야 합니다.")
        List<@NotNull(message = "테이블 번호는 비어 있을 수 없습니다.") Integer> tableNumbers,

        @NotBlank(message = "연락처는 필수입니다.")
        String contactPhone,

        String specialRequest
) {
    public CreateReservationCommand toCommand(Long userId) {
        return new CreateReservationCommand(userId, date, slot, guests, tableNumbers, contactPhone, specialRequest);
    }
}
