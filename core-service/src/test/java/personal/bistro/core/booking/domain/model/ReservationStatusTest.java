package personal.bistro.core.booking.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReservationStatus 전이 규칙 테스트")
class ReservationStatusTest {

    @Test
    @DisplayName("CONFIRMED 는 SEATED, CANCELLED, NO_SHOW 로만 전이할 수 있다")
    void confirmedTransitions() {
        assertThat(ReservationStatus.CONFIRMED.nextStatuses())
                .containsExactlyInAnyOrder(ReservationStatus.SEATED, ReservationStatus.CANCELLED,
                        ReservationStatus.NO_SHOW);
        assertThat(ReservationStatus.CONFIRMED.canTransitionTo(ReservationStatus.COMPLETED)).isFalse();
    }

    @Test
    @DisplayName("SEATED 는 COMPLETED 로만 전이할 수 있다")
    void seatedTransitions() {
        assertThat(ReservationStatus.SEATED.nextStatuses()).containsExactly(ReservationStatus.COMPLETED);
    }

    @Test
    @DisplayName("COMPLETED, CANCELLED, NO_SHOW 는 종료 상태다")
    void terminalStates() {
        assertThat(ReservationStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(ReservationStatus.CANCELLED.isTerminal()).isTrue();
        assertThat(ReservationStatus.NO_SHOW.isTerminal()).isTrue();
        assertThat(ReservationStatus.CONFIRMED.isTerminal()).isFalse();
    }

    @Test
    @DisplayName("CANCELLED, NO_SHOW 만 점유 슬롯을 반납한다")
    void releasingStates() {
        assertThat(ReservationStatus.CANCELLED.releasesSlots()).isTrue();
        assertThat(ReservationStatus.NO_SHOW.releasesSlots()).isTrue();
        assertThat(ReservationStatus.COMPLETED.releasesSlots()).isFalse();
        assertThat(ReservationStatus.SEATED.releasesSlots()).isFalse();
    }
}
