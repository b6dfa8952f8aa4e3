package personal.bistro.core.booking.domain.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.bistro.core.booking.application.config.BookingPolicyProperties;
import personal.bistro.core.booking.domain.exception.CapacityExceededException;
import personal.bistro.core.booking.domain.exception.TableOversizedException;
import personal.bistro.core.table.domain.model.DiningTable;

import java.util.List;

/**
 * Capacity Policy
 * 선택한 테이블 좌석 합은 인원 수 이상이어야 한다.
 * spareSeatLimitEnforced 일 때는 테이블별, 합계 모두 인원 + 1 을 넘을 수 없다.
 */
@Component
@RequiredArgsConstructor
public class CapacityPolicy {

    private final BookingPolicyProperties policy;

    /**
     * @throws CapacityExceededException 좌석 부족
     * @throws TableOversizedException   여유 좌석 제한 초과 (제한 활성 시)
     */
    public void check(List<DiningTable> tables, int guests) {
        int totalCapacity = tables.stream().mapToInt(DiningTable::capacity).sum();
        if (totalCapacity < guests) {
            throw new CapacityExceededException(totalCapacity, guests);
        }

        if (!policy.spareSeatLimitEnforced()) {
            return;
        }
        for (DiningTable table : tables) {
            if (!fits(table, guests)) {
                throw new TableOversizedException(String.format(
                        "Table %d seats %d, more than %d guests need", table.tableNumber(), table.capacity(), guests));
            }
        }
        if (totalCapacity > guests + 1) {
            throw new TableOversizedException(String.format(
                    "Total capacity %d leaves more than one spare seat for %d guests", totalCapacity, guests));
        }
    }

    /**
     * 테이블 하나가 여유 좌석 1석 이내로 인원을 받을 수 있는지 (가용성 조회의 권장 기준)
     */
    public boolean fits(DiningTable table, int guests) {
        return table.capacity() <= guests + 1;
    }
}
