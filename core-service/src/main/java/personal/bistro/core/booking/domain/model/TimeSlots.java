package personal.bistro.core.booking.domain.model;

import personal.bistro.core.booking.domain.exception.InvalidSlotException;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 고정 슬롯 테이블
 * 점심 11:00-13:30 (1~6), 저녁 18:00-22:00 (7~15), 30분 간격
 */
public final class TimeSlots {

    public static final int FIRST_SLOT = 1;
    public static final int LAST_SLOT = 15;

    private static final List<TimeSlot> SLOTS = buildSlots();

    private TimeSlots() {
    }

    private static List<TimeSlot> buildSlots() {
        List<TimeSlot> slots = new ArrayList<>();
        addPeriod(slots, ServicePeriod.LUNCH, LocalTime.of(11, 0), 6);
        addPeriod(slots, ServicePeriod.DINNER, LocalTime.of(18, 0), 9);
        return List.copyOf(slots);
    }

    private static void addPeriod(List<TimeSlot> slots, ServicePeriod period, LocalTime first, int count) {
        for (int i = 0; i < count; i++) {
            slots.add(new TimeSlot(slots.size() + 1, first.plusMinutes(30L * i), period));
        }
    }

    public static List<TimeSlot> all() {
        return SLOTS;
    }

    public static boolean isValid(int slot) {
        return slot >= FIRST_SLOT && slot <= LAST_SLOT;
    }

    /**
     * @throws InvalidSlotException 존재하지 않는 슬롯 번호
     */
    public static TimeSlot of(int slot) {
        if (!isValid(slot)) {
            throw new InvalidSlotException(slot);
        }
        return SLOTS.get(slot - 1);
    }

    /**
     * 시작 슬롯부터 length 개의 연속 슬롯을 점유 구간으로 계산한다.
     * 영업 구간의 마지막 슬롯에서 잘린다.
     */
    public static SlotSpan spanOf(int slot, int length) {
        TimeSlot start = of(slot);
        int last = slot;
        for (int next = slot + 1; next < slot + length && isValid(next); next++) {
            if (SLOTS.get(next - 1).period() != start.period()) {
                break;
            }
            last = next;
        }
        return new SlotSpan(slot, last);
    }
}
