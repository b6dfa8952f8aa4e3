package personal.bistro.core.booking.adapter.in.web.dto;

import personal.bistro.core.booking.application.port.in.GetAvailabilityUseCase.TableAvailability;
import personal.bistro.core.table.domain.model.DiningTable;

import java.time.LocalDate;
import java.util.List;

/**
 * 가용 테이블 조회 응답 DTO (테이블 번호 목록)
 */
public record AvailabilityResponse(
        LocalDate date,
        int slot,
        int guests,
        List<Integer> availableTables,
        List<Integer> occupiedTables,
        List<Integer> notEligibleTables
) {
    public static AvailabilityResponse of(LocalDate date, int slot, int guests, TableAvailability availability) {
        return new AvailabilityResponse(
                date,
                slot,
                guests,
                numbers(availability.available()),
                numbers(availability.occupied()),
                numbers(availability.notEligible())
        );
    }

    private static List<Integer> numbers(List<DiningTable> tables) {
        return tables.stream().map(DiningTable::tableNumber).toList();
    }
}
