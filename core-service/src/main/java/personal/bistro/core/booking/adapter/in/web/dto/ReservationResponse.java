package personal.bistro.core.booking.adapter.in.web.dto;

import personal.bistro.core.booking.domain.model.Reservation;
import personal.bistro.core.booking.domain.model.ReservationStatus;
import personal.bistro.core.booking.domain.model.TimeSlots;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 예약 조회/생성 응답 DTO
 */
public record ReservationResponse(
        Long reservationId,
        String reservationNumber,
        Long userId,
        LocalDate date,
        int slot,
        String time,
        int lastSlot,
        int guests,
        List<Integer> tableNumbers,
        ReservationStatus status,
        String contactPhone,
        String specialRequest,
        String notes,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static ReservationResponse from(Reservation reservation) {
        return new ReservationResponse(
                reservation.id(),
                reservation.reservationNumber(),
                reservation.userId(),
                reservation.date(),
                reservation.slot(),
                TimeSlots.of(reservation.slot()).label(),
                reservation.lastSlot(),
                reservation.guests(),
                reservation.tableNumbers(),
                reservation.status(),
                reservation.details().contactPhone(),
                reservation.details().specialRequest(),
                reservation.details().notes(),
                reservation.createdAt(),
                reservation.updatedAt()
        );
    }
}
