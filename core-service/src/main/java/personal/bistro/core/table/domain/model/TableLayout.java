package personal.bistro.core.table.domain.model;

import personal.bistro.core.table.domain.exception.InvalidTableAttributeException;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Table Layout
 * 최초 구축 시 생성할 테이블 수와 수용 인원 계획
 * 1번부터 smallTableCount번까지는 소형 테이블, 나머지는 대형 테이블이다.
 */
public record TableLayout(
        int tableCount,
        int smallTableCount,
        int smallTableCapacity,
        int largeTableCapacity
) {
    public TableLayout {
        if (tableCount < 1 || tableCount > DiningTable.MAX_TABLE_NUMBER) {
            throw new InvalidTableAttributeException(String.format(
                    "Table count must be between 1 and %d: %d", DiningTable.MAX_TABLE_NUMBER, tableCount));
        }
        if (smallTableCount < 0 || smallTableCount > tableCount) {
            throw new InvalidTableAttributeException(
                    String.format("Small table count must be between 0 and %d: %d", tableCount, smallTableCount));
        }
    }

    public int capacityOf(int tableNumber) {
        return tableNumber <= smallTableCount ? smallTableCapacity : largeTableCapacity;
    }

    public List<DiningTable> tables() {
        return IntStream.rangeClosed(1, tableCount)
                .mapToObj(number -> DiningTable.create(number, capacityOf(number)))
                .toList();
    }
}
