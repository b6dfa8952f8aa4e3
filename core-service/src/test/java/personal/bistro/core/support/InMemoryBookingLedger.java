package personal.bistro.core.support;

import personal.bistro.core.booking.application.port.out.BookingLedger;
import personal.bistro.core.booking.domain.model.BookingEntry;
import personal.bistro.core.booking.domain.model.SlotSpan;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 단위 테스트용 메모리 Ledger
 * failOnHold 에 지정한 테이블은 holdSlots 에서 false 를 반환한다.
 */
public class InMemoryBookingLedger implements BookingLedger {

    private final Map<LocalDate, Map<Integer, TreeSet<Integer>>> entries = new TreeMap<>();
    private final Set<Integer> failOnHold = new HashSet<>();
    private final List<Integer> holdOrder = new ArrayList<>();

    public void failOnHold(int tableNumber) {
        failOnHold.add(tableNumber);
    }

    public List<Integer> holdOrder() {
        return holdOrder;
    }

    @Override
    public Set<Integer> getOccupiedSlots(int tableNumber, LocalDate date) {
        return Collections.unmodifiableSet(new TreeSet<>(slotsOf(tableNumber, date)));
    }

    @Override
    public boolean holdSlots(int tableNumber, LocalDate date, Set<Integer> slots) {
        holdOrder.add(tableNumber);
        if (failOnHold.contains(tableNumber)) {
            return false;
        }
        TreeSet<Integer> occupied = slotsOf(tableNumber, date);
        if (slots.stream().anyMatch(occupied::contains)) {
            return false;
        }
        occupied.addAll(slots);
        return true;
    }

    @Override
    public void releaseSlots(int tableNumber, LocalDate date, Set<Integer> slots) {
        slotsOf(tableNumber, date).removeAll(slots);
    }

    @Override
    public boolean isTableFree(int tableNumber, LocalDate date, SlotSpan span) {
        return !span.overlaps(slotsOf(tableNumber, date));
    }

    @Override
    public List<BookingEntry> findEntries(LocalDate date) {
        return entries.getOrDefault(date, Map.of()).entrySet().stream()
                .filter(entry -> !entry.getValue().isEmpty())
                .map(entry -> new BookingEntry(entry.getKey(), date, new TreeSet<>(entry.getValue())))
                .toList();
    }

    private TreeSet<Integer> slotsOf(int tableNumber, LocalDate date) {
        return entries.computeIfAbsent(date, d -> new TreeMap<>())
                .computeIfAbsent(tableNumber, t -> new TreeSet<>());
    }
}
