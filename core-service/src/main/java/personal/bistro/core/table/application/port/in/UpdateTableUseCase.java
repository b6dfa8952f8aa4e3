package personal.bistro.core.table.application.port.in;

import personal.bistro.core.table.domain.model.DiningTable;

/**
 * 테이블 속성 수정 Use Case (관리자)
 */
public interface UpdateTableUseCase {

    DiningTable updateTable(UpdateTableCommand command);

    /**
     * null 인 항목은 변경하지 않는다.
     */
    record UpdateTableCommand(
            int tableNumber,
            Integer capacity,
            String notes,
            Boolean active
    ) {
    }
}
