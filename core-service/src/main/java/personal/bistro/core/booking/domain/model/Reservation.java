package personal.bistro.core.booking.domain.model;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;
import personal.bistro.core.booking.domain.exception.InvalidTransitionException;
import personal.bistro.core.booking.domain.exception.ReservationAccessDeniedException;
import personal.bistro.core.booking.domain.exception.ReservationNotModifiableException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Reservation Domain Model
 * 예약 도메인 모델 (불변)
 * 예약은 [slot, lastSlot] 구간 동안 tableNumbers 의 모든 테이블을 점유한다.
 */
public record Reservation(
        Long id,
        Long userId,
        String reservationNumber,
        LocalDate date,
        int slot,
        int lastSlot,
        int guests,
        List<Integer> tableNumbers,
        ReservationStatus status,
        ReservationDetails details,
        LocalDateTime createdAt,
        LocalDateTime updatedAt) {

    public Reservation {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation date cannot be null");
        }
        if (tableNumbers == null || tableNumbers.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation must hold at least one table");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation status cannot be null");
        }
        if (details == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation details cannot be null");
        }
        tableNumbers = tableNumbers.stream().sorted().toList();
    }

    /**
     * 예약 생성 (정적 팩토리 메서드)
     *
     * @return 새로운 예약 (CONFIRMED 상태)
     */
    public static Reservation create(Long userId, BookingRequest request, SlotSpan span,
                                     ReservationDetails details, LocalDateTime now) {
        return new Reservation(
                null,
                userId,
                ReservationNumber.of(request.date(), span.firstSlot(), request.tableNumbers()),
                request.date(),
                span.firstSlot(),
                span.lastSlot(),
                request.guests(),
                request.tableNumbers(),
                ReservationStatus.CONFIRMED,
                details,
                now,
                now);
    }

    public SlotSpan span() {
        return new SlotSpan(slot, lastSlot);
    }

    public LocalDateTime startAt() {
        return TimeSlots.of(slot).startAt(date);
    }

    public BookingRequest toBookingRequest() {
        return new BookingRequest(date, slot, guests, tableNumbers);
    }

    /**
     * 날짜/슬롯/인원/테이블 변경 (예약 번호 재생성)
     */
    public Reservation rebook(BookingRequest request, SlotSpan span, LocalDateTime now) {
        return new Reservation(
                id,
                userId,
                ReservationNumber.of(request.date(), span.firstSlot(), request.tableNumbers()),
                request.date(),
                span.firstSlot(),
                span.lastSlot(),
                request.guests(),
                request.tableNumbers(),
                status,
                details,
                createdAt,
                now);
    }

    public Reservation withDetails(ReservationDetails newDetails, LocalDateTime now) {
        return new Reservation(id, userId, reservationNumber, date, slot, lastSlot, guests,
                tableNumbers, status, newDetails, createdAt, now);
    }

    /**
     * 상태 전이
     *
     * @throws InvalidTransitionException 허용되지 않은 전이 (종료 상태 포함)
     */
    public Reservation transitionTo(ReservationStatus target, LocalDateTime now) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(id, status, target);
        }
        return new Reservation(id, userId, reservationNumber, date, slot, lastSlot, guests,
                tableNumbers, target, details, createdAt, now);
    }

    public boolean isOwnedBy(Long requestUserId) {
        return userId.equals(requestUserId);
    }

    // ========== Domain Validation Methods (Tell, Don't Ask) ==========

    /**
     * 소유권 검증
     *
     * @throws ReservationAccessDeniedException 소유권 불일치 시
     */
    public void ensureOwnership(Long requestUserId) {
        if (!isOwnedBy(requestUserId)) {
            throw new ReservationAccessDeniedException(id, requestUserId);
        }
    }

    /**
     * CONFIRMED 상태 검증 (수정 가능 여부)
     *
     * @throws ReservationNotModifiableException CONFIRMED 상태가 아닐 때
     */
    public void ensureModifiable() {
        if (status != ReservationStatus.CONFIRMED) {
            throw new ReservationNotModifiableException(id, status);
        }
    }
}
