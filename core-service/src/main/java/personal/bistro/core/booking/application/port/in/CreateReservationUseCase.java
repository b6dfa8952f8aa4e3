package personal.bistro.core.booking.application.port.in;

import personal.bistro.core.booking.domain.model.Reservation;

/**
 * 예약 생성 Use Case
 */
public interface CreateReservationUseCase {

    /**
     * 검증 후 모든 테이블의 점유 구간을 확보하고 CONFIRMED 예약을 만든다.
     * 실패 시 Ledger 에는 아무것도 남지 않는다.
     */
    Reservation create(CreateReservationCommand command);
}
