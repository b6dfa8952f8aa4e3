package personal.bistro.core.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Spring Data JPA Repository for Booked Slot
 */
public interface JpaBookedSlotRepository extends JpaRepository<BookedSlotEntity, Long> {

    List<BookedSlotEntity> findByTableNumberAndBookingDate(Integer tableNumber, LocalDate bookingDate);

    List<BookedSlotEntity> findByBookingDateOrderByTableNumberAscSlotNumberAsc(LocalDate bookingDate);

    boolean existsByTableNumberAndBookingDateAndSlotNumberIn(Integer tableNumber, LocalDate bookingDate,
                                                             Collection<Integer> slotNumbers);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM BookedSlotEntity b " +
            "WHERE b.tableNumber = :tableNumber AND b.bookingDate = :bookingDate AND b.slotNumber IN :slotNumbers")
    int deleteSlots(@Param("tableNumber") Integer tableNumber,
                    @Param("bookingDate") LocalDate bookingDate,
                    @Param("slotNumbers") Collection<Integer> slotNumbers);
}
