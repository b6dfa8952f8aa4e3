package personal.bistro.core.booking.adapter.in.web.dto;

import personal.bistro.core.booking.application.port.in.GetReservationUseCase.ReservationStatistics;
import personal.bistro.core.booking.domain.model.ReservationStatus;

/**
 * 상태별 예약 통계 응답 DTO
 */
public record ReservationStatsResponse(
        long total,
        long confirmed,
        long seated,
        long completed,
        long cancelled,
        long noShow
) {
    public static ReservationStatsResponse from(ReservationStatistics statistics) {
        return new ReservationStatsResponse(
                statistics.total(),
                statistics.byStatus().getOrDefault(ReservationStatus.CONFIRMED, 0L),
                statistics.byStatus().getOrDefault(ReservationStatus.SEATED, 0L),
                statistics.byStatus().getOrDefault(ReservationStatus.COMPLETED, 0L),
                statistics.byStatus().getOrDefault(ReservationStatus.CANCELLED, 0L),
                statistics.byStatus().getOrDefault(ReservationStatus.NO_SHOW, 0L)
        );
    }
}
