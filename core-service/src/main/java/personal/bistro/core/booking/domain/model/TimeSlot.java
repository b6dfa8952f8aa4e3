package personal.bistro.core.booking.domain.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/**
 * 30분 단위 예약 시작 시각
 *
 * @param number    슬롯 번호 (1부터 시작)
 * @param startTime 시작 시각
 * @param period    소속 영업 구간
 */
public record TimeSlot(
        int number,
        LocalTime startTime,
        ServicePeriod period
) {
    private static final DateTimeFormatter LABEL_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    public String label() {
        return startTime.format(LABEL_FORMAT);
    }

    public LocalDateTime startAt(LocalDate date) {
        return LocalDateTime.of(date, startTime);
    }
}
