package personal.bistro.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.bistro.core.auth.Requester;
import personal.bistro.core.booking.application.port.in.GetReservationUseCase;
import personal.bistro.core.booking.application.port.in.ReservationScope;
import personal.bistro.core.booking.application.port.out.ReservationRepository;
import personal.bistro.core.booking.domain.exception.ReservationNotFoundException;
import personal.bistro.core.booking.domain.model.Reservation;
import personal.bistro.core.booking.domain.model.ReservationStatus;

import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

/**
 * Reservation Query Service (SRP)
 * 단일 책임: 예약 조회
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ReservationQueryService implements GetReservationUseCase {

    private final ReservationRepository reservationRepository;
    private final Clock clock;

    @Override
    public Reservation getReservation(Long reservationId, Requester requester) {
        Reservation reservation = reservationRepository.findById(reservationId)
                .orElseThrow(() -> new ReservationNotFoundException(reservationId));

        if (!requester.admin()) {
            reservation.ensureOwnership(requester.userId());
        }
        return reservation;
    }

    @Override
    public Page<Reservation> getMyReservations(Long userId, ReservationStatus status, ReservationScope scope,
                                               Pageable pageable) {
        LocalDate today = LocalDate.now(clock);
        return switch (scope) {
            case UPCOMING -> reservationRepository.search(userId, status, today, null, true, pageable);
            case PAST -> reservationRepository.search(userId, status, null, today, true, pageable);
            case ALL -> reservationRepository.search(userId, status, null, null, true, pageable);
        };
    }

    @Override
    public Page<Reservation> searchReservations(ReservationStatus status, LocalDate date, Pageable pageable) {
        LocalDate beforeDate = date != null ? date.plusDays(1) : null;
        return reservationRepository.search(null, status, date, beforeDate, false, pageable);
    }

    @Override
    public ReservationStatistics getStatistics() {
        Map<ReservationStatus, Long> byStatus = new EnumMap<>(ReservationStatus.class);
        for (ReservationStatus status : ReservationStatus.values()) {
            byStatus.put(status, 0L);
        }
        byStatus.putAll(reservationRepository.countByStatus());

        long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
        return new ReservationStatistics(total, byStatus);
    }
}
