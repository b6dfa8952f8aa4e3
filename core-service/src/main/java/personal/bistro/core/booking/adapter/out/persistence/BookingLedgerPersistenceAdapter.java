package personal.bistro.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.bistro.core.booking.application.port.out.BookingLedger;
import personal.bistro.core.booking.domain.exception.ConcurrentReservationException;
import personal.bistro.core.booking.domain.model.BookingEntry;
import personal.bistro.core.booking.domain.model.SlotSpan;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Booking Ledger Persistence Adapter
 * booked_slots 테이블 기반 Ledger 구현체
 * 호출자의 트랜잭션에 참여하므로 예약 저장과 함께 커밋/롤백된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingLedgerPersistenceAdapter implements BookingLedger {

    private final JpaBookedSlotRepository jpaBookedSlotRepository;

    @Override
    @Transactional(readOnly = true)
    public Set<Integer> getOccupiedSlots(int tableNumber, LocalDate date) {
        return jpaBookedSlotRepository.findByTableNumberAndBookingDate(tableNumber, date).stream()
                .map(BookedSlotEntity::getSlotNumber)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    @Override
    @Transactional
    public boolean holdSlots(int tableNumber, LocalDate date, Set<Integer> slots) {
        if (slots.isEmpty()) {
            return true;
        }
        if (jpaBookedSlotRepository.existsByTableNumberAndBookingDateAndSlotNumberIn(tableNumber, date, slots)) {
            log.debug("Slots already held: table={}, date={}, slots={}", tableNumber, date, slots);
            return false;
        }

        try {
            List<BookedSlotEntity> entities = slots.stream()
                    .sorted()
                    .map(slot -> BookedSlotEntity.of(tableNumber, date, slot))
                    .toList();
            jpaBookedSlotRepository.saveAllAndFlush(entities);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent hold detected: table={}, date={}, slots={}", tableNumber, date, slots);
            throw new ConcurrentReservationException(
                    String.format("Table %d on %s was held by a concurrent request", tableNumber, date), e);
        }
    }

    @Override
    @Transactional
    public void releaseSlots(int tableNumber, LocalDate date, Set<Integer> slots) {
        if (slots.isEmpty()) {
            return;
        }
        int released = jpaBookedSlotRepository.deleteSlots(tableNumber, date, slots);
        log.debug("Slots released: table={}, date={}, requested={}, released={}",
                tableNumber, date, slots, released);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isTableFree(int tableNumber, LocalDate date, SlotSpan span) {
        return !jpaBookedSlotRepository.existsByTableNumberAndBookingDateAndSlotNumberIn(
                tableNumber, date, span.slots());
    }

    @Override
    @Transactional(readOnly = true)
    public List<BookingEntry> findEntries(LocalDate date) {
        Map<Integer, SortedSet<Integer>> byTable = new TreeMap<>();
        for (BookedSlotEntity entity : jpaBookedSlotRepository.findByBookingDateOrderByTableNumberAscSlotNumberAsc(date)) {
            byTable.computeIfAbsent(entity.getTableNumber(), key -> new TreeSet<>()).add(entity.getSlotNumber());
        }
        return byTable.entrySet().stream()
                .map(entry -> new BookingEntry(entry.getKey(), date, Collections.unmodifiableSortedSet(entry.getValue())))
                .toList();
    }
}
