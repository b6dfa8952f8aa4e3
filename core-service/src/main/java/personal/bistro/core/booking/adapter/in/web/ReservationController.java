package personal.bistro.core.booking.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.bistro.core.auth.Requester;
import personal.bistro.core.booking.adapter.in.web.dto.CreateReservationRequest;
import personal.bistro.core.booking.adapter.in.web.dto.ReservationPageResponse;
import personal.bistro.core.booking.adapter.in.web.dto.ReservationResponse;
import personal.bistro.core.booking.adapter.in.web.dto.UpdateReservationRequest;
import personal.bistro.core.booking.application.port.in.CancelReservationUseCase;
import personal.bistro.core.booking.application.port.in.CreateReservationUseCase;
import personal.bistro.core.booking.application.port.in.GetReservationUseCase;
import personal.bistro.core.booking.application.port.in.ReservationScope;
import personal.bistro.core.booking.application.port.in.UpdateReservationUseCase;
import personal.bistro.core.booking.domain.model.Reservation;
import personal.bistro.core.booking.domain.model.ReservationStatus;

/**
 * Reservation API Controller
 * 사용자 예약 생성/조회/변경/취소 REST API
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/reservations")
@RequiredArgsConstructor
public class ReservationController {

    private final CreateReservationUseCase createReservationUseCase;
    private final UpdateReservationUseCase updateReservationUseCase;
    private final CancelReservationUseCase cancelReservationUseCase;
    private final GetReservationUseCase getReservationUseCase;

    /**
     * 예약 생성
     * POST /api/v1/reservations
     */
    @PostMapping
    public ResponseEntity<ReservationResponse> createReservation(
            @Valid @RequestBody CreateReservationRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Create reservation: userId={}, date={}, slot={}, tables={}",
                userId, request.date(), request.slot(), request.tableNumbers());

        Reservation reservation = createReservationUseCase.create(request.toCommand(userId));

        return ResponseEntity.status(HttpStatus.CREATED).body(ReservationResponse.from(reservation));
    }

    /**
     * 내 예약 목록
     * GET /api/v1/reservations?status=CONFIRMED&scope=UPCOMING&page=0&size=20
     */
    @GetMapping
    public ResponseEntity<ReservationPageResponse> getMyReservations(
            @RequestHeader("X-User-Id") Long userId,
            @RequestParam(required = false) ReservationStatus status,
            @RequestParam(defaultValue = "ALL") ReservationScope scope,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size
    ) {
        var reservations = getReservationUseCase.getMyReservations(userId, status, scope, PageRequest.of(page, size));
        return ResponseEntity.ok(ReservationPageResponse.from(reservations));
    }

    /**
     * 예약 조회 (소유자 또는 관리자)
     * GET /api/v1/reservations/{reservationId}
     */
    @GetMapping("/{reservationId}")
    public ResponseEntity<ReservationResponse> getReservation(
            @PathVariable Long reservationId,
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader(value = "X-User-Role", required = false) String role
    ) {
        Reservation reservation = getReservationUseCase.getReservation(reservationId, Requester.of(userId, role));
        return ResponseEntity.ok(ReservationResponse.from(reservation));
    }

    /**
     * 예약 변경 (소유자)
     * PUT /api/v1/reservations/{reservationId}
     */
    @PutMapping("/{reservationId}")
    public ResponseEntity<ReservationResponse> updateReservation(
            @PathVariable Long reservationId,
            @Valid @RequestBody UpdateReservationRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Update reservation: reservationId={}, userId={}", reservationId, userId);

        Reservation reservation = updateReservationUseCase.update(
                request.toCommand(reservationId, Requester.user(userId)));
        return ResponseEntity.ok(ReservationResponse.from(reservation));
    }

    /**
     * 예약 취소 (소유자)
     * DELETE /api/v1/reservations/{reservationId}
     */
    @DeleteMapping("/{reservationId}")
    public ResponseEntity<ReservationResponse> cancelReservation(
            @PathVariable Long reservationId,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Cancel reservation: reservationId={}, userId={}", reservationId, userId);

        Reservation reservation = cancelReservationUseCase.cancel(reservationId, Requester.user(userId));
        return ResponseEntity.ok(ReservationResponse.from(reservation));
    }
}
