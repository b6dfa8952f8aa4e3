package personal.bistro.core.booking.adapter.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Booked Slot JPA Entity
 * Booking Ledger 의 한 칸: (테이블, 날짜, 슬롯) 점유 기록
 * Unique 제약이 이중 점유에 대한 최종 방어선이다.
 */
@Entity
@Table(name = "booked_slots",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_table_date_slot",
                columnNames = {"table_number", "booking_date", "slot_number"}
        ),
        indexes = @Index(name = "idx_booked_slots_date", columnList = "booking_date"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookedSlotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "table_number", nullable = false)
    private Integer tableNumber;

    @Column(name = "booking_date", nullable = false)
    private LocalDate bookingDate;

    @Column(name = "slot_number", nullable = false)
    private Integer slotNumber;

    public static BookedSlotEntity of(int tableNumber, LocalDate bookingDate, int slotNumber) {
        BookedSlotEntity entity = new BookedSlotEntity();
        entity.tableNumber = tableNumber;
        entity.bookingDate = bookingDate;
        entity.slotNumber = slotNumber;
        return entity;
    }
}
