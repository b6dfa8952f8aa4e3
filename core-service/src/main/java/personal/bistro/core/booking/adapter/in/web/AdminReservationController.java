package personal.bistro.core.booking.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.bistro.core.auth.Requester;
import personal.bistro.core.booking.adapter.in.web.dto.ChangeStatusRequest;
import personal.bistro.core.booking.adapter.in.web.dto.ReservationPageResponse;
import personal.bistro.core.booking.adapter.in.web.dto.ReservationResponse;
import personal.bistro.core.booking.adapter.in.web.dto.ReservationStatsResponse;
import personal.bistro.core.booking.adapter.in.web.dto.UpdateReservationRequest;
import personal.bistro.core.booking.application.port.in.ChangeReservationStatusUseCase;
import personal.bistro.core.booking.application.port.in.GetReservationUseCase;
import personal.bistro.core.booking.application.port.in.UpdateReservationUseCase;
import personal.bistro.core.booking.domain.model.Reservation;
import personal.bistro.core.booking.domain.model.ReservationStatus;

import java.time.LocalDate;

/**
 * Admin Reservation API Controller
 * 관리자 예약 검색/통계/변경/상태 전이 REST API
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/admin/reservations")
@RequiredArgsConstructor
public class AdminReservationController {

    private final GetReservationUseCase getReservationUseCase;
    private final UpdateReservationUseCase updateReservationUseCase;
    private final ChangeReservationStatusUseCase changeReservationStatusUseCase;

    /**
     * 예약 검색
     * GET /api/v1/admin/reservations?status=CONFIRMED&date=2026-11-02
     */
    @GetMapping
    public ResponseEntity<ReservationPageResponse> searchReservations(
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader(value = "X-User-Role", required = false) String role,
            @RequestParam(required = false) ReservationStatus status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size
    ) {
        Requester.of(userId, role).ensureAdmin();

        var reservations = getReservationUseCase.searchReservations(status, date, PageRequest.of(page, size));
        return ResponseEntity.ok(ReservationPageResponse.from(reservations));
    }

    /**
     * 상태별 예약 통계
     * GET /api/v1/admin/reservations/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<ReservationStatsResponse> getStatistics(
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader(value = "X-User-Role", required = false) String role
    ) {
        Requester.of(userId, role).ensureAdmin();
        return ResponseEntity.ok(ReservationStatsResponse.from(getReservationUseCase.getStatistics()));
    }

    /**
     * 예약 변경 (시간 제한 없음, 메모 수정 가능)
     * PUT /api/v1/admin/reservations/{reservationId}
     */
    @PutMapping("/{reservationId}")
    public ResponseEntity<ReservationResponse> updateReservation(
            @PathVariable Long reservationId,
            @Valid @RequestBody UpdateReservationRequest request,
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader(value = "X-User-Role", required = false) String role
    ) {
        Requester requester = Requester.of(userId, role);
        requester.ensureAdmin();
        log.info("Admin update reservation: reservationId={}, adminId={}", reservationId, userId);

        Reservation reservation = updateReservationUseCase.update(request.toCommand(reservationId, requester));
        return ResponseEntity.ok(ReservationResponse.from(reservation));
    }

    /**
     * 예약 상태 변경
     * PATCH /api/v1/admin/reservations/{reservationId}/status
     */
    @PatchMapping("/{reservationId}/status")
    public ResponseEntity<ReservationResponse> changeStatus(
            @PathVariable Long reservationId,
            @Valid @RequestBody ChangeStatusRequest request,
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader(value = "X-User-Role", required = false) String role
    ) {
        log.info("Change reservation status: reservationId={}, target={}, adminId={}",
                reservationId, request.status(), userId);

        Reservation reservation = changeReservationStatusUseCase.changeStatus(
                reservationId, request.status(), Requester.of(userId, role));
        return ResponseEntity.ok(ReservationResponse.from(reservation));
    }
}
