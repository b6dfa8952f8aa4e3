package personal.bistro.core.booking.application.port.out;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import personal.bistro.core.booking.domain.model.Reservation;
import personal.bistro.core.booking.domain.model.ReservationStatus;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * Reservation Repository (Output Port)
 */
public interface ReservationRepository {

    Reservation save(Reservation reservation);

    Optional<Reservation> findById(Long id);

    /**
     * 조건 검색 (null 조건은 무시)
     *
     * @param userId     소유자
     * @param status     상태
     * @param fromDate   이 날짜 이후 (포함)
     * @param beforeDate  이 날짜 이전 (미포함)
     * @param newestFirst true: 날짜/슬롯 내림차순, false: 오름차순
     */
    Page<Reservation> search(Long userId, ReservationStatus status, LocalDate fromDate, LocalDate beforeDate,
                             boolean newestFirst, Pageable pageable);

    Map<ReservationStatus, Long> countByStatus();
}
