package personal.bistro.core.booking.adapter.in.web.dto;

import personal.bistro.core.booking.domain.model.ServicePeriod;
import personal.bistro.core.booking.domain.model.TimeSlot;

/**
 * 슬롯 목록 응답 DTO
 */
public record TimeSlotResponse(
        int slot,
        String time,
        ServicePeriod period
) {
    public static TimeSlotResponse from(TimeSlot timeSlot) {
        return new TimeSlotResponse(timeSlot.number(), timeSlot.label(), timeSlot.period());
    }
}
