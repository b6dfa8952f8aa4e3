package personal.bistro.core.booking.domain.model;

import java.time.LocalDate;
import java.util.SortedSet;

/**
 * 테이블 하나의 특정 날짜 점유 슬롯
 */
public record BookingEntry(
        int tableNumber,
        LocalDate date,
        SortedSet<Integer> slots
) {
}
