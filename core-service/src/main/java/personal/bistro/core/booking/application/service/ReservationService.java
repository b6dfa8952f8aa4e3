package personal.bistro.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import personal.bistro.core.auth.Requester;
import personal.bistro.core.booking.application.port.in.CancelReservationUseCase;
import personal.bistro.core.booking.application.port.in.ChangeReservationStatusUseCase;
import personal.bistro.core.booking.application.port.in.CreateReservationCommand;
import personal.bistro.core.booking.application.port.in.CreateReservationUseCase;
import personal.bistro.core.booking.application.port.in.UpdateReservationCommand;
import personal.bistro.core.booking.application.port.in.UpdateReservationUseCase;
import personal.bistro.core.booking.application.port.out.ReservationNotificationPort;
import personal.bistro.core.booking.application.port.out.ReservationRepository;
import personal.bistro.core.booking.application.port.out.SlotLockPort;
import personal.bistro.core.booking.domain.exception.ConcurrentReservationException;
import personal.bistro.core.booking.domain.exception.ReservationNotFoundException;
import personal.bistro.core.booking.domain.model.BookingRequest;
import personal.bistro.core.booking.domain.model.Reservation;
import personal.bistro.core.booking.domain.model.ReservationStatus;
import personal.bistro.core.booking.domain.model.SlotLockKey;
import personal.bistro.core.booking.domain.service.ReservationManager;

import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Reservation Service
 * 점유를 바꾸는 모든 요청은 관련 (테이블, 날짜) 잠금을 정렬 순서로 잡은 뒤
 * 트랜잭션을 실행하고, 커밋 이후 잠금을 해제한다. 알림은 잠금 해제 후 발행한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationService implements CreateReservationUseCase, UpdateReservationUseCase,
        CancelReservationUseCase, ChangeReservationStatusUseCase {

    private final SlotLockPort slotLockPort;
    private final ReservationRepository reservationRepository;
    private final ReservationManager reservationManager;
    private final ReservationNotificationPort notificationPort;

    @Override
    public Reservation create(CreateReservationCommand command) {
        SortedSet<SlotLockKey> keys = lockKeys(command.date(), command.tableNumbers());

        Reservation created = withSlotLocks(keys, () -> reservationManager.createInTransaction(command));
        notifySafely(notificationPort::notifyCreated, created);
        return created;
    }

    @Override
    public Reservation update(UpdateReservationCommand command) {
        Reservation current = load(command.reservationId());
        BookingRequest next = command.mergeInto(current);

        // 기존 점유와 새 점유 양쪽의 키를 모두 잡는다
        SortedSet<SlotLockKey> keys = lockKeys(current.date(), current.tableNumbers());
        keys.addAll(lockKeys(next.date(), next.tableNumbers()));

        Reservation updated = withSlotLocks(keys, () -> {
            Reservation locked = load(command.reservationId());
            ensureCovered(keys, locked, command.mergeInto(locked));
            return reservationManager.updateInTransaction(command);
        });
        notifySafely(notificationPort::notifyUpdated, updated);
        return updated;
    }

    @Override
    public Reservation cancel(Long reservationId, Requester requester) {
        Reservation cancelled = transition(reservationId, ReservationStatus.CANCELLED, requester);
        notifySafely(notificationPort::notifyCancelled, cancelled);
        return cancelled;
    }

    @Override
    public Reservation changeStatus(Long reservationId, ReservationStatus target, Requester requester) {
        requester.ensureAdmin();

        Reservation changed = transition(reservationId, target, requester);
        if (changed.status() == ReservationStatus.CANCELLED) {
            notifySafely(notificationPort::notifyCancelled, changed);
        }
        return changed;
    }

    private Reservation transition(Long reservationId, ReservationStatus target, Requester requester) {
        Reservation current = load(reservationId);
        SortedSet<SlotLockKey> keys = lockKeys(current.date(), current.tableNumbers());

        return withSlotLocks(keys, () -> {
            ensureCovered(keys, load(reservationId), null);
            return reservationManager.transitionInTransaction(reservationId, target, requester);
        });
    }

    /**
     * 잠금 전에 읽은 예약이 그 사이 다른 테이블/날짜로 옮겨졌다면 잡지 않은 키를 건드리게 되므로 실패시킨다.
     */
    private void ensureCovered(SortedSet<SlotLockKey> locked, Reservation reservation, BookingRequest next) {
        SortedSet<SlotLockKey> required = lockKeys(reservation.date(), reservation.tableNumbers());
        if (next != null) {
            required.addAll(lockKeys(next.date(), next.tableNumbers()));
        }
        if (!locked.containsAll(required)) {
            log.warn("Reservation moved while waiting for locks: id={}, locked={}, required={}",
                    reservation.id(), locked, required);
            throw new ConcurrentReservationException(
                    String.format("Reservation %d was changed by a concurrent request", reservation.id()));
        }
    }

    /**
     * 정렬된 순서로 모든 잠금을 잡고 작업을 실행한다.
     * 하나라도 실패하면 이미 잡은 잠금을 풀고 CONCURRENT_RESERVATION 으로 실패한다.
     */
    private <T> T withSlotLocks(Collection<SlotLockKey> keys, Supplier<T> work) {
        String owner = UUID.randomUUID().toString();
        Deque<String> acquired = new ArrayDeque<>();

        try {
            for (SlotLockKey key : keys) {
                String lockKey = key.asString();
                if (!slotLockPort.tryLock(lockKey, owner)) {
                    log.warn("Slot lock not acquired: key={}", lockKey);
                    throw new ConcurrentReservationException(
                            String.format("Another request is changing %s", lockKey));
                }
                acquired.push(lockKey);
            }

            return work.get();

        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent booking detected by unique constraint: keys={}", keys);
            throw new ConcurrentReservationException("Slots were taken by a concurrent request", e);

        } finally {
            while (!acquired.isEmpty()) {
                slotLockPort.unlock(acquired.pop(), owner);
            }
        }
    }

    private SortedSet<SlotLockKey> lockKeys(LocalDate date, List<Integer> tableNumbers) {
        SortedSet<SlotLockKey> keys = new TreeSet<>();
        if (date == null) {
            return keys;
        }
        for (Integer tableNumber : tableNumbers) {
            if (tableNumber != null) {
                keys.add(new SlotLockKey(tableNumber, date));
            }
        }
        return keys;
    }

    private Reservation load(Long reservationId) {
        return reservationRepository.findById(reservationId)
                .orElseThrow(() -> new ReservationNotFoundException(reservationId));
    }

    private void notifySafely(Consumer<Reservation> notifier, Reservation reservation) {
        try {
            notifier.accept(reservation);
        } catch (RuntimeException e) {
            log.warn("Reservation notification failed: id={}, status={}", reservation.id(), reservation.status(), e);
        }
    }
}
