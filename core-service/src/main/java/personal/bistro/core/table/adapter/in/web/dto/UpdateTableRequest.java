package personal.bistro.core.table.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import personal.bistro.core.table.application.port.in.UpdateTableUseCase.UpdateTableCommand;

/**
 * 테이블 수정 요청 DTO (부분 수정)
 * 범위 검증은 도메인 모델에서 수행한다.
 */
public record UpdateTableRequest(
        Integer capacity,
        String notes,
        @JsonProperty("isActive") Boolean isActive
) {
    public UpdateTableCommand toCommand(int tableNumber) {
        return new UpdateTableCommand(tableNumber, capacity, notes, isActive);
    }
}
