package personal.bistro.core.booking.adapter.in.web.dto;

import org.springframework.data.domain.Page;
import personal.bistro.core.booking.domain.model.Reservation;

import java.util.List;

/**
 * 예약 목록 응답 DTO (페이지)
 */
public record ReservationPageResponse(
        List<ReservationResponse> reservations,
        int page,
        int size,
        long totalElements,
        int totalPages
) {
    public static ReservationPageResponse from(Page<Reservation> page) {
        return new ReservationPageResponse(
                page.getContent().stream().map(ReservationResponse::from).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages()
        );
    }
}
