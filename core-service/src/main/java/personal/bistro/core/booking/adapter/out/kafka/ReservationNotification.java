package personal.bistro.core.booking.adapter.out.kafka;

import personal.bistro.core.booking.domain.model.Reservation;
import personal.bistro.core.booking.domain.model.ReservationStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 예약 알림 메시지 (Kafka JSON payload)
 */
public record ReservationNotification(
        String eventType,
        Long reservationId,
        String reservationNumber,
        Long userId,
        LocalDate date,
        int slot,
        String time,
        int guests,
        List<Integer> tableNumbers,
        ReservationStatus status,
        String contactPhone,
        LocalDateTime occurredAt
) {
    public static ReservationNotification of(String eventType, Reservation reservation) {
        return new ReservationNotification(
                eventType,
                reservation.id(),
                reservation.reservationNumber(),
                reservation.userId(),
                reservation.date(),
                reservation.slot(),
                reservation.startAt().toLocalTime().toString(),
                reservation.guests(),
                reservation.tableNumbers(),
                reservation.status(),
                reservation.details().contactPhone(),
                reservation.updatedAt());
    }
}
