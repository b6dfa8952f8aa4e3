package personal.bistro.core.booking.domain.model;

/**
 * 영업 구간
 * 예약 점유 구간은 시작 슬롯이 속한 영업 구간을 넘어가지 않는다.
 */
public enum ServicePeriod {
    LUNCH,
    DINNER
}
