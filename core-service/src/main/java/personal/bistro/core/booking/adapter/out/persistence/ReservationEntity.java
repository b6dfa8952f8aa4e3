package personal.bistro.core.booking.adapter.out.persistence;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.bistro.core.booking.domain.model.Reservation;
import personal.bistro.core.booking.domain.model.ReservationDetails;
import personal.bistro.core.booking.domain.model.ReservationStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Reservation JPA Entity
 * 예약 테이블 매핑
 * 예약 번호는 사람이 읽기 위한 값이라 Unique 제약을 두지 않는다.
 */
@Entity
@Table(name = "reservations",
        indexes = {
                @Index(name = "idx_reservations_user_date", columnList = "user_id, reservation_date"),
                @Index(name = "idx_reservations_date_status", columnList = "reservation_date, status")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReservationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "reservation_number", nullable = false, length = 64)
    private String reservationNumber;

    @Column(name = "reservation_date", nullable = false)
    private LocalDate reservationDate;

    @Column(name = "slot_number", nullable = false)
    private Integer slotNumber;

    @Column(name = "last_slot_number", nullable = false)
    private Integer lastSlotNumber;

    @Column(nullable = false)
    private Integer guests;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "reservation_tables", joinColumns = @JoinColumn(name = "reservation_id"))
    @OrderColumn(name = "table_order")
    @Column(name = "table_number", nullable = false)
    private List<Integer> tableNumbers = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReservationStatus status;

    @Column(name = "contact_phone", nullable = false, length = 10)
    private String contactPhone;

    @Column(name = "special_request", length = 200)
    private String specialRequest;

    @Column(length = 300)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 도메인 모델로부터 엔티티 생성
     */
    public static ReservationEntity fromDomain(Reservation reservation) {
        ReservationEntity entity = new ReservationEntity();
        entity.id = reservation.id();
        entity.userId = reservation.userId();
        entity.reservationNumber = reservation.reservationNumber();
        entity.reservationDate = reservation.date();
        entity.slotNumber = reservation.slot();
        entity.lastSlotNumber = reservation.lastSlot();
        entity.guests = reservation.guests();
        entity.tableNumbers = new ArrayList<>(reservation.tableNumbers());
        entity.status = reservation.status();
        entity.contactPhone = reservation.details().contactPhone();
        entity.specialRequest = reservation.details().specialRequest();
        entity.notes = reservation.details().notes();
        entity.createdAt = reservation.createdAt();
        entity.updatedAt = reservation.updatedAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * 도메인 모델로 변환
     */
    public Reservation toDomain() {
        return new Reservation(
                id,
                userId,
                reservationNumber,
                reservationDate,
                slotNumber,
                lastSlotNumber,
                guests,
                List.copyOf(tableNumbers),
                status,
                new ReservationDetails(contactPhone, specialRequest, notes),
                createdAt,
                updatedAt);
    }
}
