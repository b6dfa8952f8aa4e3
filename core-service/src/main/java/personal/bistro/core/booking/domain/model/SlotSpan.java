package personal.bistro.core.booking.domain.model;

import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 예약 하나가 테이블을 점유하는 연속 슬롯 구간 [firstSlot, lastSlot]
 */
public record SlotSpan(int firstSlot, int lastSlot) {

    public SlotSpan {
        if (firstSlot > lastSlot) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Invalid slot span: %d-%d", firstSlot, lastSlot));
        }
    }

    public SortedSet<Integer> slots() {
        SortedSet<Integer> slots = new TreeSet<>();
        for (int slot = firstSlot; slot <= lastSlot; slot++) {
            slots.add(slot);
        }
        return Collections.unmodifiableSortedSet(slots);
    }

    public boolean contains(int slot) {
        return slot >= firstSlot && slot <= lastSlot;
    }

    public boolean overlaps(Collection<Integer> occupied) {
        return occupied.stream().anyMatch(this::contains);
    }

    @Override
    public String toString() {
        return firstSlot == lastSlot ? String.valueOf(firstSlot) : firstSlot + "-" + lastSlot;
    }
}
