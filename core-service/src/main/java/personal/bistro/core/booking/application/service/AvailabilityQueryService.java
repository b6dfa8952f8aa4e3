package personal.bistro.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.bistro.core.booking.application.config.BookingPolicyProperties;
import personal.bistro.core.booking.application.port.in.GetAvailabilityUseCase;
import personal.bistro.core.booking.application.port.out.BookingLedger;
import personal.bistro.core.booking.application.port.out.ReservationRepository;
import personal.bistro.core.booking.domain.exception.InvalidGuestCountException;
import personal.bistro.core.booking.domain.model.BookingEntry;
import personal.bistro.core.booking.domain.model.Reservation;
import personal.bistro.core.booking.domain.model.SlotSpan;
import personal.bistro.core.booking.domain.model.TimeSlot;
import personal.bistro.core.booking.domain.model.TimeSlots;
import personal.bistro.core.booking.domain.service.CapacityPolicy;
import personal.bistro.core.table.application.port.out.TableRepository;
import personal.bistro.core.table.domain.model.DiningTable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Availability Query Service
 * Booking Ledger 기준 테이블 가용성 조회 (읽기 전용, 잠금 없음)
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AvailabilityQueryService implements GetAvailabilityUseCase {

    private final TableRepository tableRepository;
    private final BookingLedger bookingLedger;
    private final ReservationRepository reservationRepository;
    private final CapacityPolicy capacityPolicy;
    private final BookingPolicyProperties policy;

    @Override
    public TableAvailability findAvailableTables(LocalDate date, int slot, int guests, Long excludeReservationId) {
        SlotSpan span = TimeSlots.spanOf(slot, policy.serviceSpanSlots());
        if (guests < 1 || guests > policy.maxGuests()) {
            throw new InvalidGuestCountException(guests, policy.maxGuests());
        }
        Reservation excluded = excludeReservationId == null ? null
                : reservationRepository.findById(excludeReservationId).orElse(null);

        List<DiningTable> available = new ArrayList<>();
        List<DiningTable> occupied = new ArrayList<>();
        List<DiningTable> notEligible = new ArrayList<>();

        for (DiningTable table : tableRepository.findAllActive()) {
            Set<Integer> booked = new HashSet<>(bookingLedger.getOccupiedSlots(table.tableNumber(), date));
            if (excluded != null && excluded.date().equals(date)
                    && excluded.tableNumbers().contains(table.tableNumber())) {
                booked.removeAll(excluded.span().slots());
            }

            if (span.overlaps(booked)) {
                occupied.add(table);
            } else if (!capacityPolicy.fits(table, guests)) {
                notEligible.add(table);
            } else {
                available.add(table);
            }
        }

        log.debug("Availability: date={}, slot={}, guests={}, available={}, occupied={}, notEligible={}",
                date, slot, guests, available.size(), occupied.size(), notEligible.size());
        return new TableAvailability(available, occupied, notEligible);
    }

    @Override
    public List<TableDaySchedule> getDailyAvailability(LocalDate date) {
        Map<Integer, BookingEntry> entries = bookingLedger.findEntries(date).stream()
                .collect(Collectors.toMap(BookingEntry::tableNumber, Function.identity()));

        return tableRepository.findAllActive().stream()
                .map(table -> toSchedule(table, entries.get(table.tableNumber())))
                .toList();
    }

    private TableDaySchedule toSchedule(DiningTable table, BookingEntry entry) {
        SortedSet<Integer> booked = entry == null ? new TreeSet<>() : new TreeSet<>(entry.slots());
        // 시작 슬롯은 점유 구간 전체가 비어 있어야 예약 가능하다
        SortedSet<Integer> free = TimeSlots.all().stream()
                .map(TimeSlot::number)
                .filter(number -> !TimeSlots.spanOf(number, policy.serviceSpanSlots()).overlaps(booked))
                .collect(Collectors.toCollection(TreeSet::new));

        return new TableDaySchedule(
                table.tableNumber(),
                table.capacity(),
                Collections.unmodifiableSortedSet(booked),
                Collections.unmodifiableSortedSet(free),
                free.isEmpty());
    }
}
