package personal.bistro.core.booking.adapter.in.web;

import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.bistro.core.booking.adapter.in.web.dto.AvailabilityResponse;
import personal.bistro.core.booking.adapter.in.web.dto.TableScheduleResponse;
import personal.bistro.core.booking.adapter.in.web.dto.TimeSlotResponse;
import personal.bistro.core.booking.application.port.in.GetAvailabilityUseCase;
import personal.bistro.core.booking.application.port.in.GetAvailabilityUseCase.TableAvailability;
import personal.bistro.core.booking.domain.model.TimeSlots;

import java.time.LocalDate;
import java.util.List;

/**
 * Availability API Controller
 * 슬롯 목록, 슬롯별 가용 테이블, 날짜별 테이블 점유 현황 조회
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AvailabilityController {

    private final GetAvailabilityUseCase getAvailabilityUseCase;

    /**
     * 예약 가능 시간대 목록
     * GET /api/v1/time-slots
     */
    @GetMapping("/time-slots")
    public ResponseEntity<List<TimeSlotResponse>> getTimeSlots() {
        return ResponseEntity.ok(TimeSlots.all().stream().map(TimeSlotResponse::from).toList());
    }

    /**
     * 슬롯별 가용 테이블
     * GET /api/v1/availability?date=2026-11-02&slot=7&guests=4
     */
    @GetMapping("/availability")
    public ResponseEntity<AvailabilityResponse> findAvailableTables(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam int slot,
            @RequestParam(defaultValue = "1") int guests,
            @RequestParam(required = false) Long excludeReservationId
    ) {
        TableAvailability availability =
                getAvailabilityUseCase.findAvailableTables(date, slot, guests, excludeReservationId);
        return ResponseEntity.ok(AvailabilityResponse.of(date, slot, guests, availability));
    }

    /**
     * 날짜별 테이블 점유 현황
     * GET /api/v1/tables/availability?date=2026-11-02
     */
    @GetMapping("/tables/availability")
    public ResponseEntity<List<TableScheduleResponse>> getDailyAvailability(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        List<TableScheduleResponse> response = getAvailabilityUseCase.getDailyAvailability(date).stream()
                .map(TableScheduleResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }
}
