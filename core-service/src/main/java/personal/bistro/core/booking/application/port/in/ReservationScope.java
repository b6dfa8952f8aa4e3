package personal.bistro.core.booking.application.port.in;

/**
 * 내 예약 목록 조회 범위
 */
public enum ReservationScope {
    /**
     * 오늘 이후 예약
     */
    UPCOMING,

    /**
     * 어제까지의 예약
     */
    PAST,

    ALL
}
