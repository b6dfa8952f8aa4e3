package personal.bistro.core.booking.domain.model;

import personal.bistro.core.booking.domain.exception.TableInvalidException;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * 점유 검증 대상 (날짜, 시작 슬롯, 인원, 테이블)
 */
public record BookingRequest(
        LocalDate date,
        int slot,
        int guests,
        List<Integer> tableNumbers
) {
    public BookingRequest {
        tableNumbers = copyTableNumbers(tableNumbers);
    }

    /**
     * null 목록은 빈 목록으로, null 원소는 TABLE_INVALID 로 처리한다.
     */
    public static List<Integer> copyTableNumbers(List<Integer> tableNumbers) {
        if (tableNumbers == null) {
            return List.of();
        }
        if (tableNumbers.stream().anyMatch(Objects::isNull)) {
            throw TableInvalidException.missingNumber();
        }
        return List.copyOf(tableNumbers);
    }

    public boolean sameBookingAs(Reservation reservation) {
        return date.equals(reservation.date())
                && slot == reservation.slot()
                && tableNumbers.stream().sorted().toList().equals(reservation.tableNumbers());
    }
}
