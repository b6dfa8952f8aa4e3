package personal.bistro.core.booking.domain.exception;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;
import personal.bistro.core.booking.domain.model.SlotSpan;

import java.time.LocalDate;

/**
 * 요청 구간이 기존 예약과 겹칠 때 발생
 */
public class SlotConflictException extends BusinessException {

    private final int tableNumber;

    public SlotConflictException(int tableNumber, LocalDate date, SlotSpan span) {
        super(ErrorCode.SLOT_CONFLICT,
                String.format("Table %d is already booked on %s for slots %s", tableNumber, date, span));
        this.tableNumber = tableNumber;
    }

    public int getTableNumber() {
        return tableNumber;
    }
}
