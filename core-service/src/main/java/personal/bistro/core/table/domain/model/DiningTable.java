package personal.bistro.core.table.domain.model;

import personal.bistro.core.table.domain.exception.InvalidTableAttributeException;

/**
 * Dining Table Domain Model
 * 매장의 물리적 테이블 (불변)
 * tableNumber는 식별자이며 생성 이후 변경되지 않는다.
 */
public record DiningTable(
        int tableNumber,
        int capacity,
        boolean active,
        String notes
) {
    public static final int MIN_TABLE_NUMBER = 1;
    public static final int MAX_TABLE_NUMBER = 22;
    public static final int MIN_CAPACITY = 1;
    public static final int MAX_CAPACITY = 12;
    public static final int MAX_NOTES_LENGTH = 200;

    public DiningTable {
        if (tableNumber < MIN_TABLE_NUMBER || tableNumber > MAX_TABLE_NUMBER) {
            throw new InvalidTableAttributeException(String.format(
                    "Table number must be between %d and %d: %d", MIN_TABLE_NUMBER, MAX_TABLE_NUMBER, tableNumber));
        }
        if (capacity < MIN_CAPACITY || capacity > MAX_CAPACITY) {
            throw new InvalidTableAttributeException(String.format(
                    "Table capacity must be between %d and %d: %d", MIN_CAPACITY, MAX_CAPACITY, capacity));
        }
        if (notes != null && notes.length() > MAX_NOTES_LENGTH) {
            throw new InvalidTableAttributeException(
                    String.format("Notes cannot exceed %d characters", MAX_NOTES_LENGTH));
        }
    }

    /**
     * 신규 테이블 생성 (활성 상태)
     */
    public static DiningTable create(int tableNumber, int capacity) {
        return new DiningTable(tableNumber, capacity, true, null);
    }

    /**
     * 부분 수정 - null 인 항목은 기존 값을 유지한다.
     */
    public DiningTable update(Integer newCapacity, String newNotes, Boolean newActive) {
        return new DiningTable(
                tableNumber,
                newCapacity != null ? newCapacity : capacity,
                newActive != null ? newActive : active,
                newNotes != null ? newNotes : notes);
    }
}
