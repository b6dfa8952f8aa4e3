package personal.bistro.core.acceptance.support;

import io.cucumber.spring.ScenarioScope;
import io.restassured.response.Response;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Reservation Acceptance Test Context
 * 같은 시나리오의 Step 들이 공유하는 상태
 */
@Getter
@Setter
@ScenarioScope
public class ReservationTestContext {

    /** 기본 예약 날짜 (테스트 시계 기준 다음 날) */
    private LocalDate reservationDate = LocalDate.of(2026, 11, 2);
    /** 현재 사용자 ID */
    private Long currentUserId = 1L;
    /** 관리자 ID */
    private Long adminId = 99L;
    /** 마지막 HTTP 응답 */
    private Response lastHttpResponse;
    /** 마지막으로 생성된 예약 ID */
    private Long currentReservationId;
    /** 동시 요청의 응답 상태 코드 */
    private final List<Integer> concurrentStatusCodes = new CopyOnWriteArrayList<>();
}
