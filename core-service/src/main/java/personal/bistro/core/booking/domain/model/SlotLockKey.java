package personal.bistro.core.booking.domain.model;

import java.time.LocalDate;
import java.util.Comparator;

/**
 * (테이블, 날짜) 단위 잠금 키
 * 여러 키를 잡을 때는 날짜, 테이블 번호 순으로 정렬해 교착을 막는다.
 */
public record SlotLockKey(int tableNumber, LocalDate date) implements Comparable<SlotLockKey> {

    private static final Comparator<SlotLockKey> ORDER = Comparator
            .comparing(SlotLockKey::date)
            .thenComparingInt(SlotLockKey::tableNumber);

    public String asString() {
        return String.format("table:%d:%s", tableNumber, date);
    }

    @Override
    public int compareTo(SlotLockKey other) {
        return ORDER.compare(this, other);
    }
}
