package personal.bistro.core.booking.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 예약 정책 설정
 *
 * @param serviceSpanSlots        예약 하나가 점유하는 연속 슬롯 수
 * @param maxGuests               예약 당 최대 인원
 * @param cancellationWindowHours 사용자 취소 가능 시한 (시작 N시간 전까지)
 * @param modificationWindowHours 사용자 변경 가능 시한 (시작 N시간 전까지)
 * @param spareSeatLimitEnforced  테이블 조합의 여유 좌석을 1석으로 제한할지 여부
 */
@ConfigurationProperties(prefix = "booking.policy")
public record BookingPolicyProperties(
        @DefaultValue("3") int serviceSpanSlots,
        @DefaultValue("20") int maxGuests,
        @DefaultValue("2") long cancellationWindowHours,
        @DefaultValue("1") long modificationWindowHours,
        @DefaultValue("false") boolean spareSeatLimitEnforced
) {
}
