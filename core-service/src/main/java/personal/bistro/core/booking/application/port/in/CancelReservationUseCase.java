package personal.bistro.core.booking.application.port.in;

import personal.bistro.core.auth.Requester;
import personal.bistro.core.booking.domain.model.Reservation;

/**
 * 예약 취소 Use Case
 */
public interface CancelReservationUseCase {

    Reservation cancel(Long reservationId, Requester requester);
}
