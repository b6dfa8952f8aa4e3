package personal.bistro.core.booking.application.port.out;

import personal.bistro.core.booking.domain.model.BookingEntry;
import personal.bistro.core.booking.domain.model.SlotSpan;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Booking Ledger (Output Port)
 * (테이블, 날짜) 별 점유 슬롯 기록
 * 같은 (테이블, 날짜, 슬롯)은 두 번 점유될 수 없다.
 */
public interface BookingLedger {

    /**
     * 점유 슬롯 조회 (기록이 없으면 빈 집합)
     */
    Set<Integer> getOccupiedSlots(int tableNumber, LocalDate date);

    /**
     * 슬롯 점유
     * 이미 점유된 슬롯이 하나라도 있으면 아무것도 기록하지 않고 false 반환
     *
     * @throws personal.bistro.core.booking.domain.exception.ConcurrentReservationException
     *         확인 이후 다른 요청이 먼저 기록한 경우
     */
    boolean holdSlots(int tableNumber, LocalDate date, Set<Integer> slots);

    /**
     * 슬롯 반납 (점유되지 않은 슬롯은 무시)
     */
    void releaseSlots(int tableNumber, LocalDate date, Set<Integer> slots);

    boolean isTableFree(int tableNumber, LocalDate date, SlotSpan span);

    /**
     * 해당 날짜에 점유 기록이 있는 테이블별 항목
     */
    List<BookingEntry> findEntries(LocalDate date);
}
