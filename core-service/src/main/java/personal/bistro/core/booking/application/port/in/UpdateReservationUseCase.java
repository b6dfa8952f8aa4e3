package personal.bistro.core.booking.application.port.in;

import personal.bistro.core.booking.domain.model.Reservation;

/**
 * 예약 변경 Use Case
 */
public interface UpdateReservationUseCase {

    /**
     * 날짜/슬롯/인원/테이블이 바뀌면 기존 점유를 새 점유로 옮긴다.
     * 새 점유에 실패하면 기존 점유와 예약은 변경되지 않는다.
     */
    Reservation update(UpdateReservationCommand command);
}
