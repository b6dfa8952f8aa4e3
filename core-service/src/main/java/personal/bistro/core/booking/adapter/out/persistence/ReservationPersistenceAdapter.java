package personal.bistro.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import personal.bistro.core.booking.application.port.out.ReservationRepository;
import personal.bistro.core.booking.domain.model.Reservation;
import personal.bistro.core.booking.domain.model.ReservationStatus;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reservation Persistence Adapter
 * JPA를 사용한 예약 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationPersistenceAdapter implements ReservationRepository {

    private static final Sort OLDEST_FIRST = Sort.by("reservationDate", "slotNumber", "id");
    private static final Sort NEWEST_FIRST = OLDEST_FIRST.descending();

    private final JpaReservationRepository jpaReservationRepository;

    @Override
    public Reservation save(Reservation reservation) {
        log.debug("Saving reservation: id={}, tables={}, status={}",
                reservation.id(), reservation.tableNumbers(), reservation.status());

        var entity = ReservationEntity.fromDomain(reservation);
        var saved = jpaReservationRepository.save(entity);
        return saved.toDomain();
    }

    @Override
    public Optional<Reservation> findById(Long reservationId) {
        return jpaReservationRepository.findById(reservationId)
                .map(ReservationEntity::toDomain);
    }

    @Override
    public Page<Reservation> search(Long userId, ReservationStatus status, LocalDate fromDate, LocalDate beforeDate,
                                    boolean newestFirst, Pageable pageable) {
        Pageable sorted = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(),
                newestFirst ? NEWEST_FIRST : OLDEST_FIRST);
        return jpaReservationRepository.search(userId, status, fromDate, beforeDate, sorted)
                .map(ReservationEntity::toDomain);
    }

    @Override
    public Map<ReservationStatus, Long> countByStatus() {
        Map<ReservationStatus, Long> counts = new EnumMap<>(ReservationStatus.class);
        for (Object[] row : jpaReservationRepository.countGroupByStatus()) {
            counts.put((ReservationStatus) row[0], (Long) row[1]);
        }
        return counts;
    }
}
