package personal.bistro.core.booking.application.port.in;

import personal.bistro.core.auth.Requester;
import personal.bistro.core.booking.domain.model.Reservation;
import personal.bistro.core.booking.domain.model.ReservationStatus;

/**
 * 예약 상태 변경 Use Case (관리자)
 */
public interface ChangeReservationStatusUseCase {

    Reservation changeStatus(Long reservationId, ReservationStatus target, Requester requester);
}
