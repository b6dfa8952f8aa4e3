package personal.bistro.core.booking.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Reservation Status Enum
 * CONFIRMED -> SEATED -> COMPLETED, CONFIRMED -> CANCELLED | NO_SHOW
 */
public enum ReservationStatus {
    /**
     * 예약 확정 (초기 상태)
     */
    CONFIRMED,

    /**
     * 손님 착석
     */
    SEATED,

    /**
     * 식사 완료
     */
    COMPLETED,

    /**
     * 취소
     */
    CANCELLED,

    /**
     * 노쇼
     */
    NO_SHOW;

    public Set<ReservationStatus> nextStatuses() {
        return switch (this) {
            case CONFIRMED -> EnumSet.of(SEATED, CANCELLED, NO_SHOW);
            case SEATED -> EnumSet.of(COMPLETED);
            case COMPLETED, CANCELLED, NO_SHOW -> EnumSet.noneOf(ReservationStatus.class);
        };
    }

    public boolean canTransitionTo(ReservationStatus target) {
        return nextStatuses().contains(target);
    }

    public boolean isTerminal() {
        return nextStatuses().isEmpty();
    }

    /**
     * 이 상태로 진입하면 점유 슬롯을 반납한다.
     * COMPLETED는 이미 지난 시간대라 점유 기록을 이력으로 남긴다.
     */
    public boolean releasesSlots() {
        return this == CANCELLED || this == NO_SHOW;
    }
}
