package personal.bistro.core.booking.application.port.out;

import personal.bistro.core.booking.domain.model.Reservation;

/**
 * Reservation Notification (Output Port)
 * 예약 생성/변경/취소 알림 발행
 * 구현체는 예외를 던지지 않으며, 알림 실패가 예약 처리 결과를 바꾸지 않는다.
 */
public interface ReservationNotificationPort {

    void notifyCreated(Reservation reservation);

    void notifyUpdated(Reservation reservation);

    void notifyCancelled(Reservation reservation);
}
