package personal.bistro.core.booking.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import personal.bistro.core.booking.application.port.in.GetAvailabilityUseCase.TableDaySchedule;

import java.util.List;

/**
 * 날짜별 테이블 점유 현황 응답 DTO
 */
public record TableScheduleResponse(
        int tableNumber,
        int capacity,
        List<Integer> bookedSlots,
        List<Integer> availableSlots,
        @JsonProperty("isFullyBooked") boolean fullyBooked
) {
    public static TableScheduleResponse from(TableDaySchedule schedule) {
        return new TableScheduleResponse(
                schedule.tableNumber(),
                schedule.capacity(),
                List.copyOf(schedule.bookedSlots()),
                List.copyOf(schedule.availableSlots()),
                schedule.fullyBooked()
        );
    }
}
