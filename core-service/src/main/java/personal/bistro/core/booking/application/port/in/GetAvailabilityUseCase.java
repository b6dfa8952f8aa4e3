package personal.bistro.core.booking.application.port.in;

import personal.bistro.core.table.domain.model.DiningTable;

import java.time.LocalDate;
import java.util.List;
import java.util.SortedSet;

/**
 * 가용 테이블 조회 Use Case
 */
public interface GetAvailabilityUseCase {

    /**
     * 특정 날짜/슬롯/인원 기준으로 활성 테이블을 세 그룹으로 나눈다.
     *
     * @param excludeReservationId 변경 중인 예약 (해당 예약의 점유는 비어 있는 것으로 본다), 없으면 null
     */
    TableAvailability findAvailableTables(LocalDate date, int slot, int guests, Long excludeReservationId);

    /**
     * 날짜별 테이블 점유 현황
     */
    List<TableDaySchedule> getDailyAvailability(LocalDate date);

    /**
     * @param available   구간 전체가 비어 있고 인원에 맞는 테이블
     * @param occupied    구간 중 일부가 이미 점유된 테이블
     * @param notEligible 비어 있지만 인원에 비해 너무 큰 테이블 (수용 인원 > 인원 + 1)
     */
    record TableAvailability(
            List<DiningTable> available,
            List<DiningTable> occupied,
            List<DiningTable> notEligible
    ) {
    }

    record TableDaySchedule(
            int tableNumber,
            int capacity,
            SortedSet<Integer> bookedSlots,
            SortedSet<Integer> availableSlots,
            boolean fullyBooked
    ) {
    }
}
