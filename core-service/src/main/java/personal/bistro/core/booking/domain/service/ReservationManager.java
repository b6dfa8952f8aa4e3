package personal.bistro.core.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.bistro.core.auth.Requester;
import personal.bistro.core.booking.application.port.in.CreateReservationCommand;
import personal.bistro.core.booking.application.port.in.UpdateReservationCommand;
import personal.bistro.core.booking.application.port.out.ReservationRepository;
import personal.bistro.core.booking.domain.exception.ReservationNotFoundException;
import personal.bistro.core.booking.domain.model.BookingRequest;
import personal.bistro.core.booking.domain.model.Reservation;
import personal.bistro.core.booking.domain.model.ReservationDetails;
import personal.bistro.core.booking.domain.model.ReservationStatus;
import personal.bistro.core.booking.domain.model.SlotSpan;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Reservation Domain Service (Transaction Manager)
 * 트랜잭션 범위 분리를 위한 실행 전용 서비스
 * 잠금은 호출자(ReservationService)가 트랜잭션 바깥에서 잡고, 커밋 이후 해제한다.
 * 예약 저장과 Ledger 점유 변경은 같은 트랜잭션에서 함께 커밋되거나 함께 롤백된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationManager {

    private final ReservationRepository reservationRepository;
    private final ReservationConflictResolver conflictResolver;
    private final ReservationLifecycle lifecycle;
    private final Clock clock;

    @Transactional
    public Reservation createInTransaction(CreateReservationCommand command) {
        // 1. 부가 정보 검증 (연락처 형식 등)
        ReservationDetails details = new ReservationDetails(command.contactPhone(), command.specialRequest(), null);

        // 2. 검증 + 전체 테이블 점유 (DB Unique 제약이 2차 방어선)
        BookingRequest request = command.toBookingRequest();
        SlotSpan span = conflictResolver.reserve(request);

        // 3. CONFIRMED 예약 저장
        Reservation reservation = Reservation.create(command.userId(), request, span, details, now());
        Reservation saved = reservationRepository.save(reservation);

        log.info("Reservation created: id={}, number={}, tables={}, date={}, span={}",
                saved.id(), saved.reservationNumber(), saved.tableNumbers(), saved.date(), span);
        return saved;
    }

    @Transactional
    public Reservation updateInTransaction(UpdateReservationCommand command) {
        Requester requester = command.requester();
        Reservation current = load(command.reservationId());
        BookingRequest next = command.mergeInto(current);

        // 1. 권한, 상태, 변경 가능 시간 검증
        lifecycle.ensureModifiable(current, next, requester);
        if (command.notes() != null) {
            requester.ensureAdmin();
        }
        ReservationDetails details = current.details()
                .merge(command.contactPhone(), command.specialRequest(), command.notes());

        // 2. 점유 이동 (날짜/슬롯/테이블이 그대로면 Ledger 는 건드리지 않고 인원만 재검증)
        Reservation updated;
        if (next.equals(current.toBookingRequest())) {
            updated = current;
        } else if (next.sameBookingAs(current)) {
            SlotSpan span = conflictResolver.validate(next);
            updated = current.rebook(next, span, now());
        } else {
            SlotSpan span = conflictResolver.rebook(current, next);
            updated = current.rebook(next, span, now());
        }

        Reservation saved = reservationRepository.save(updated.withDetails(details, now()));
        log.info("Reservation updated: id={}, number={}, tables={}, date={}, span={}",
                saved.id(), saved.reservationNumber(), saved.tableNumbers(), saved.date(), saved.span());
        return saved;
    }

    @Transactional
    public Reservation transitionInTransaction(Long reservationId, ReservationStatus target, Requester requester) {
        Reservation current = load(reservationId);
        Reservation transitioned = lifecycle.transition(current, target, requester);

        Reservation saved = reservationRepository.save(transitioned);
        log.info("Reservation status changed: id={}, {} -> {}, by userId={}",
                saved.id(), current.status(), saved.status(), requester.userId());
        return saved;
    }

    private Reservation load(Long reservationId) {
        return reservationRepository.findById(reservationId)
                .orElseThrow(() -> new ReservationNotFoundException(reservationId));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
