package personal.bistro.core.booking.adapter.out.persistence;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.bistro.core.booking.domain.model.ReservationStatus;

import java.time.LocalDate;
import java.util.List;

/**
 * Spring Data JPA Repository for Reservation
 */
public interface JpaReservationRepository extends JpaRepository<ReservationEntity, Long> {

    @Query("SELECT r FROM ReservationEntity r " +
            "WHERE (:userId IS NULL OR r.userId = :userId) " +
            "AND (:status IS NULL OR r.status = :status) " +
            "AND (:fromDate IS NULL OR r.reservationDate >= :fromDate) " +
            "AND (:beforeDate IS NULL OR r.reservationDate < :beforeDate)")
    Page<ReservationEntity> search(@Param("userId") Long userId,
                                   @Param("status") ReservationStatus status,
                                   @Param("fromDate") LocalDate fromDate,
                                   @Param("beforeDate") LocalDate beforeDate,
                                   Pageable pageable);

    @Query("SELECT r.status, COUNT(r) FROM ReservationEntity r GROUP BY r.status")
    List<Object[]> countGroupByStatus();
}
