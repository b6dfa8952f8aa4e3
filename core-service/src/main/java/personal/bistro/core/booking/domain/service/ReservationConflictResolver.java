package personal.bistro.core.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.bistro.common.exception.BusinessException;
import personal.bistro.core.booking.application.config.BookingPolicyProperties;
import personal.bistro.core.booking.application.port.out.BookingLedger;
import personal.bistro.core.booking.domain.exception.InvalidGuestCountException;
import personal.bistro.core.booking.domain.exception.ReservationDateInPastException;
import personal.bistro.core.booking.domain.exception.SlotConflictException;
import personal.bistro.core.booking.domain.exception.TableInvalidException;
import personal.bistro.core.booking.domain.model.BookingRequest;
import personal.bistro.core.booking.domain.model.Reservation;
import personal.bistro.core.booking.domain.model.SlotSpan;
import personal.bistro.core.booking.domain.model.TimeSlots;
import personal.bistro.core.table.application.port.out.TableRepository;
import personal.bistro.core.table.domain.model.DiningTable;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reservation Conflict Resolver
 * 예약 요청을 검증하고 Booking Ledger 에 전부 점유하거나 전혀 점유하지 않는다.
 * 호출자는 관련 (테이블, 날짜) 잠금을 잡은 상태여야 한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationConflictResolver {

    private final TableRepository tableRepository;
    private final BookingLedger bookingLedger;
    private final CapacityPolicy capacityPolicy;
    private final BookingPolicyProperties policy;
    private final Clock clock;

    /**
     * 점유 없이 요청만 검증하고 점유 구간을 계산한다.
     * 날짜, 슬롯, 인원, 테이블 존재/활성, 좌석 수 순서로 검사한다.
     */
    public SlotSpan validate(BookingRequest request) {
        LocalDate today = LocalDate.now(clock);
        if (request.date() == null || request.date().isBefore(today)) {
            throw new ReservationDateInPastException(request.date(), today);
        }
        SlotSpan span = TimeSlots.spanOf(request.slot(), policy.serviceSpanSlots());

        if (request.guests() < 1 || request.guests() > policy.maxGuests()) {
            throw new InvalidGuestCountException(request.guests(), policy.maxGuests());
        }

        List<DiningTable> tables = loadTables(request.tableNumbers());
        capacityPolicy.check(tables, request.guests());
        return span;
    }

    /**
     * 검증 후 모든 테이블의 구간을 점유한다.
     *
     * @throws SlotConflictException 겹치는 테이블 중 번호가 가장 작은 테이블을 담는다
     */
    public SlotSpan reserve(BookingRequest request) {
        SlotSpan span = validate(request);
        hold(request, span);
        return span;
    }

    /**
     * 기존 예약의 점유를 새 요청으로 옮긴다.
     * 새 구간 점유에 실패하면 기존 점유를 복구하고 원래 예외를 그대로 던진다.
     */
    public SlotSpan rebook(Reservation current, BookingRequest next) {
        SlotSpan span = validate(next);

        release(current);
        try {
            hold(next, span);
        } catch (BusinessException e) {
            restore(current);
            throw e;
        }
        log.debug("Reservation rebooked: id={}, tables={}, date={}, span={}",
                current.id(), next.tableNumbers(), next.date(), span);
        return span;
    }

    /**
     * 예약이 점유한 모든 슬롯 반납 (멱등)
     */
    public void release(Reservation reservation) {
        for (Integer tableNumber : reservation.tableNumbers()) {
            bookingLedger.releaseSlots(tableNumber, reservation.date(), reservation.span().slots());
        }
    }

    private List<DiningTable> loadTables(List<Integer> tableNumbers) {
        if (tableNumbers.isEmpty()) {
            throw new TableInvalidException("At least one table must be selected");
        }
        if (new HashSet<>(tableNumbers).size() != tableNumbers.size()) {
            throw new TableInvalidException(String.format("Duplicate table numbers: %s", tableNumbers));
        }

        Map<Integer, DiningTable> found = tableRepository.findAllByTableNumbers(tableNumbers).stream()
                .collect(Collectors.toMap(DiningTable::tableNumber, Function.identity()));

        List<DiningTable> tables = new ArrayList<>();
        for (Integer tableNumber : tableNumbers.stream().sorted().toList()) {
            DiningTable table = found.get(tableNumber);
            if (table == null) {
                throw TableInvalidException.notFound(tableNumber);
            }
            if (!table.active()) {
                throw TableInvalidException.inactive(tableNumber);
            }
            tables.add(table);
        }
        return tables;
    }

    private void hold(BookingRequest request, SlotSpan span) {
        List<Integer> ordered = request.tableNumbers().stream().sorted().toList();

        for (Integer tableNumber : ordered) {
            if (!bookingLedger.isTableFree(tableNumber, request.date(), span)) {
                throw new SlotConflictException(tableNumber, request.date(), span);
            }
        }

        List<Integer> held = new ArrayList<>();
        try {
            for (Integer tableNumber : ordered) {
                if (!bookingLedger.holdSlots(tableNumber, request.date(), span.slots())) {
                    throw new SlotConflictException(tableNumber, request.date(), span);
                }
                held.add(tableNumber);
            }
        } catch (RuntimeException e) {
            compensate(held, request.date(), span);
            throw e;
        }
    }

    private void compensate(List<Integer> held, LocalDate date, SlotSpan span) {
        for (Integer tableNumber : held) {
            try {
                bookingLedger.releaseSlots(tableNumber, date, span.slots());
            } catch (RuntimeException e) {
                log.error("Failed to release partially held slots: table={}, date={}, span={}",
                        tableNumber, date, span, e);
            }
        }
    }

    private void restore(Reservation current) {
        try {
            hold(current.toBookingRequest(), current.span());
        } catch (RuntimeException e) {
            log.error("Failed to restore original booking after rebook failure: id={}, tables={}, date={}",
                    current.id(), current.tableNumbers(), current.date(), e);
        }
    }
}
