package personal.bistro.core.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.bistro.core.auth.Requester;
import personal.bistro.core.booking.application.config.BookingPolicyProperties;
import personal.bistro.core.booking.domain.exception.CancellationWindowClosedException;
import personal.bistro.core.booking.domain.exception.InvalidTransitionException;
import personal.bistro.core.booking.domain.exception.ModificationWindowClosedException;
import personal.bistro.core.booking.domain.exception.TransitionTooEarlyException;
import personal.bistro.core.booking.domain.model.BookingRequest;
import personal.bistro.core.booking.domain.model.Reservation;
import personal.bistro.core.booking.domain.model.ReservationStatus;
import personal.bistro.core.booking.domain.model.TimeSlots;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Reservation Lifecycle
 * 상태 전이 권한과 시간 조건을 검증하고, 슬롯을 반납하는 전이에서는 Ledger 점유를 해제한다.
 * <p>
 * CONFIRMED -> SEATED, NO_SHOW : 관리자, 예약 시작 이후
 * CONFIRMED -> CANCELLED       : 소유자는 시작 N시간 전까지, 관리자는 언제든
 * SEATED -> COMPLETED          : 관리자
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationLifecycle {

    private final ReservationConflictResolver conflictResolver;
    private final BookingPolicyProperties policy;
    private final Clock clock;

    /**
     * 상태 전이
     *
     * @return 전이된 예약 (저장은 호출자가 수행)
     */
    public Reservation transition(Reservation reservation, ReservationStatus target, Requester requester) {
        if (target == ReservationStatus.CANCELLED) {
            if (!requester.admin()) {
                reservation.ensureOwnership(requester.userId());
            }
        } else {
            requester.ensureAdmin();
        }

        if (!reservation.status().canTransitionTo(target)) {
            throw new InvalidTransitionException(reservation.id(), reservation.status(), target);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime startAt = reservation.startAt();
        switch (target) {
            case CANCELLED -> {
                if (!requester.admin() && isWithin(now, startAt, policy.cancellationWindowHours())) {
                    throw new CancellationWindowClosedException(reservation.id(), policy.cancellationWindowHours());
                }
            }
            case SEATED, NO_SHOW, COMPLETED -> {
                if (now.isBefore(startAt)) {
                    throw new TransitionTooEarlyException(reservation.id(), target, startAt);
                }
            }
            default -> throw new InvalidTransitionException(reservation.id(), reservation.status(), target);
        }

        Reservation transitioned = reservation.transitionTo(target, now);
        if (target.releasesSlots()) {
            conflictResolver.release(reservation);
            log.debug("Slots released by {}: id={}, tables={}, date={}, span={}",
                    target, reservation.id(), reservation.tableNumbers(), reservation.date(), reservation.span());
        }
        return transitioned;
    }

    /**
     * 예약 변경 가능 여부 검증
     * CONFIRMED 상태만 변경할 수 있으며, 사용자는 원래 시작 시각과 새 시작 시각 모두
     * N시간 이상 남아 있어야 한다. 관리자는 시간 제한이 없다.
     */
    public void ensureModifiable(Reservation reservation, BookingRequest next, Requester requester) {
        if (!requester.admin()) {
            reservation.ensureOwnership(requester.userId());
        }
        reservation.ensureModifiable();
        if (requester.admin()) {
            return;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        long windowHours = policy.modificationWindowHours();
        if (isWithin(now, reservation.startAt(), windowHours)) {
            throw new ModificationWindowClosedException(String.format(
                    "Reservation %d can only be modified at least %d hours before it starts",
                    reservation.id(), windowHours));
        }
        // 지난 날짜와 잘못된 슬롯은 Conflict Resolver 검증에서 거절된다.
        if (TimeSlots.isValid(next.slot()) && next.date() != null && !next.date().isBefore(now.toLocalDate())) {
            LocalDateTime newStartAt = TimeSlots.of(next.slot()).startAt(next.date());
            if (isWithin(now, newStartAt, windowHours)) {
                throw new ModificationWindowClosedException(String.format(
                        "New reservation time must be at least %d hours from now", windowHours));
            }
        }
    }

    private boolean isWithin(LocalDateTime now, LocalDateTime startAt, long hours) {
        return Duration.between(now, startAt).compareTo(Duration.ofHours(hours)) < 0;
    }
}
