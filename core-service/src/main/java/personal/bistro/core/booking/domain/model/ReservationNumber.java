package personal.bistro.core.booking.domain.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * 사람이 읽는 예약 번호 생성기
 * 형식: YYYYMMDD-HHMM-T{n}-T{m} (테이블 번호 오름차순)
 * 고유 식별자가 아니며, 식별은 예약 ID로 한다.
 */
public final class ReservationNumber {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HHmm");

    private ReservationNumber() {
    }

    public static String of(LocalDate date, int slot, Collection<Integer> tableNumbers) {
        String tables = tableNumbers.stream()
                .sorted()
                .map(number -> "T" + number)
                .collect(Collectors.joining("-"));
        return date.format(DATE_FORMAT) + "-" + TimeSlots.of(slot).startTime().format(TIME_FORMAT) + "-" + tables;
    }
}
