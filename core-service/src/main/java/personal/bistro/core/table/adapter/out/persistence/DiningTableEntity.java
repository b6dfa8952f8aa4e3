package personal.bistro.core.table.adapter.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.bistro.core.table.domain.model.DiningTable;

import java.time.LocalDateTime;

/**
 * Dining Table JPA Entity
 * 테이블 번호가 곧 기본 키다.
 */
@Entity
@Table(name = "dining_tables")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DiningTableEntity {

    @Id
    @Column(name = "table_number")
    private Integer tableNumber;

    @Column(nullable = false)
    private Integer capacity;

    @Column(name = "is_active", nullable = false)
    private Boolean active;

    @Column(length = 200)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    private DiningTableEntity(Integer tableNumber, Integer capacity, Boolean active, String notes) {
        this.tableNumber = tableNumber;
        this.capacity = capacity;
        this.active = active;
        this.notes = notes;
    }

    public static DiningTableEntity fromDomain(DiningTable table) {
        return new DiningTableEntity(table.tableNumber(), table.capacity(), table.active(), table.notes());
    }

    public DiningTable toDomain() {
        return new DiningTable(tableNumber, capacity, active, notes);
    }

    void apply(DiningTable table) {
        this.capacity = table.capacity();
        this.active = table.active();
        this.notes = table.notes();
    }

    @PrePersist
    void onCreate() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
