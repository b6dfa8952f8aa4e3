package personal.bistro.core.table.application.port.in;

import personal.bistro.core.table.domain.model.DiningTable;

import java.util.List;

/**
 * 테이블 조회 Use Case
 */
public interface GetTableUseCase {

    DiningTable getTable(int tableNumber);

    /**
     * 전체 테이블 (비활성 포함), 번호 오름차순
     */
    List<DiningTable> getAllTables();

    /**
     * 예약 가능한 활성 테이블, 번호 오름차순
     */
    List<DiningTable> getActiveTables();
}
