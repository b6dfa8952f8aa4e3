package personal.bistro.core.table.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import personal.bistro.core.table.domain.model.DiningTable;

/**
 * 테이블 응답 DTO
 */
public record TableResponse(
        int tableNumber,
        int capacity,
        @JsonProperty("isActive") boolean active,
        String notes
) {
    public static TableResponse from(DiningTable table) {
        return new TableResponse(table.tableNumber(), table.capacity(), table.active(), table.notes());
    }
}
