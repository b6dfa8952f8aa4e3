package personal.bistro.core.booking.application.port.in;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import personal.bistro.core.auth.Requester;
import personal.bistro.core.booking.domain.model.Reservation;
import personal.bistro.core.booking.domain.model.ReservationStatus;

import java.time.LocalDate;
import java.util.Map;

/**
 * 예약 조회 Use Case
 */
public interface GetReservationUseCase {

    /**
     * 단건 조회 (소유자 또는 관리자)
     */
    Reservation getReservation(Long reservationId, Requester requester);

    /**
     * 내 예약 목록 (최신 순)
     *
     * @param status null 이면 전체 상태
     */
    Page<Reservation> getMyReservations(Long userId, ReservationStatus status, ReservationScope scope,
                                        Pageable pageable);

    /**
     * 관리자 검색 (null 조건은 무시), 날짜/슬롯 오름차순
     */
    Page<Reservation> searchReservations(ReservationStatus status, LocalDate date, Pageable pageable);

    ReservationStatistics getStatistics();

    /**
     * 상태별 예약 수
     */
    record ReservationStatistics(long total, Map<ReservationStatus, Long> byStatus) {
    }
}
