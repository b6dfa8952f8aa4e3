package personal.bistro.core.booking.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;
import personal.bistro.core.auth.Requester;
import personal.bistro.core.booking.application.config.BookingPolicyProperties;
import personal.bistro.core.booking.domain.exception.CancellationWindowClosedException;
import personal.bistro.core.booking.domain.exception.InvalidTransitionException;
import personal.bistro.core.booking.domain.exception.ModificationWindowClosedException;
import personal.bistro.core.booking.domain.exception.ReservationAccessDeniedException;
import personal.bistro.core.booking.domain.exception.TransitionTooEarlyException;
import personal.bistro.core.booking.domain.model.BookingRequest;
import personal.bistro.core.booking.domain.model.Reservation;
import personal.bistro.core.booking.domain.model.ReservationDetails;
import personal.bistro.core.booking.domain.model.ReservationStatus;
import personal.bistro.core.support.TestClock;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReservationLifecycle 단위 테스트")
class ReservationLifecycleTest {

    private static final LocalDate DATE = LocalDate.of(2026, 11, 2);
    // 슬롯 10 = 19:30
    private static final LocalDateTime START_AT = LocalDateTime.of(2026, 11, 2, 19, 30);
    private static final Long OWNER_ID = 1L;

    @Mock
    private ReservationConflictResolver conflictResolver;

    private TestClock clock;
    private ReservationLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        clock = new TestClock(LocalDateTime.of(2026, 11, 1, 9, 0));
        lifecycle = new ReservationLifecycle(conflictResolver, new BookingPolicyProperties(3, 20, 2, 1, false), clock);
    }

    private Reservation reservation(ReservationStatus status) {
        return new Reservation(100L, OWNER_ID, "20261102-1930-T5", DATE, 10, 12, 2, List.of(5), status,
                new ReservationDetails("0101234567", null, null), LocalDateTime.now(clock), LocalDateTime.now(clock));
    }

    @Nested
    @DisplayName("취소")
    class Cancel {

        @Test
        @DisplayName("소유자는 시작 2시간 전까지 취소할 수 있고 슬롯이 반납된다")
        void ownerCancels() {
            clock.setNow(START_AT.minusHours(2));

            Reservation cancelled = lifecycle.transition(
                    reservation(ReservationStatus.CONFIRMED), ReservationStatus.CANCELLED, Requester.user(OWNER_ID));

            assertThat(cancelled.status()).isEqualTo(ReservationStatus.CANCELLED);
            then(conflictResolver).should().release(any(Reservation.class));
        }

        @Test
        @DisplayName("소유자는 시작 2시간 이내에는 취소할 수 없다")
        void ownerCannotCancelInsideWindow() {
            clock.setNow(START_AT.minusHours(2).plusMinutes(1));

            assertThatThrownBy(() -> lifecycle.transition(
                    reservation(ReservationStatus.CONFIRMED), ReservationStatus.CANCELLED, Requester.user(OWNER_ID)))
                    .isInstanceOf(CancellationWindowClosedException.class);
            then(conflictResolver).should(never()).release(any());
        }

        @Test
        @DisplayName("관리자는 시간 제한 없이 취소할 수 있다")
        void adminCancelsAnytime() {
            clock.setNow(START_AT.plusMinutes(10));

            Reservation cancelled = lifecycle.transition(
                    reservation(ReservationStatus.CONFIRMED), ReservationStatus.CANCELLED, Requester.admin(99L));

            assertThat(cancelled.status()).isEqualTo(ReservationStatus.CANCELLED);
        }

        @Test
        @DisplayName("다른 사용자의 예약은 취소할 수 없다")
        void otherUserCannotCancel() {
            assertThatThrownBy(() -> lifecycle.transition(
                    reservation(ReservationStatus.CONFIRMED), ReservationStatus.CANCELLED, Requester.user(2L)))
                    .isInstanceOf(ReservationAccessDeniedException.class);
        }

        @Test
        @DisplayName("이미 취소된 예약은 INVALID_TRANSITION")
        void cancelTwice() {
            assertThatThrownBy(() -> lifecycle.transition(
                    reservation(ReservationStatus.CANCELLED), ReservationStatus.CANCELLED, Requester.user(OWNER_ID)))
                    .isInstanceOf(InvalidTransitionException.class);
        }
    }

    @Nested
    @DisplayName("관리자 전이")
    class AdminTransition {

        @Test
        @DisplayName("일반 사용자는 착석 처리를 할 수 없다")
        void userCannotSeat() {
            assertThatThrownBy(() -> lifecycle.transition(
                    reservation(ReservationStatus.CONFIRMED), ReservationStatus.SEATED, Requester.user(OWNER_ID)))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.FORBIDDEN));
        }

        @Test
        @DisplayName("예약 시작 전에는 착석, 노쇼 처리를 할 수 없다")
        void tooEarly() {
            clock.setNow(START_AT.minusMinutes(1));

            assertThatThrownBy(() -> lifecycle.transition(
                    reservation(ReservationStatus.CONFIRMED), ReservationStatus.SEATED, Requester.admin(99L)))
                    .isInstanceOf(TransitionTooEarlyException.class);
            assertThatThrownBy(() -> lifecycle.transition(
                    reservation(ReservationStatus.CONFIRMED), ReservationStatus.NO_SHOW, Requester.admin(99L)))
                    .isInstanceOf(TransitionTooEarlyException.class);
        }

        @Test
        @DisplayName("착석은 슬롯을 유지하고, 노쇼는 슬롯을 반납한다")
        void seatedKeepsNoShowReleases() {
            clock.setNow(START_AT);

            Reservation seated = lifecycle.transition(
                    reservation(ReservationStatus.CONFIRMED), ReservationStatus.SEATED, Requester.admin(99L));
            assertThat(seated.status()).isEqualTo(ReservationStatus.SEATED);
            then(conflictResolver).should(never()).release(any());

            Reservation noShow = lifecycle.transition(
                    reservation(ReservationStatus.CONFIRMED), ReservationStatus.NO_SHOW, Requester.admin(99L));
            assertThat(noShow.status()).isEqualTo(ReservationStatus.NO_SHOW);
            then(conflictResolver).should().release(any(Reservation.class));
        }

        @Test
        @DisplayName("완료는 슬롯을 유지한다")
        void completedKeepsSlots() {
            clock.setNow(START_AT.plusHours(1));

            Reservation completed = lifecycle.transition(
                    reservation(ReservationStatus.SEATED), ReservationStatus.COMPLETED, Requester.admin(99L));

            assertThat(completed.status()).isEqualTo(ReservationStatus.COMPLETED);
            then(conflictResolver).should(never()).release(any());
        }

        @Test
        @DisplayName("CONFIRMED 에서 바로 완료할 수 없다")
        void confirmedCannotComplete() {
            clock.setNow(START_AT.plusHours(1));

            assertThatThrownBy(() -> lifecycle.transition(
                    reservation(ReservationStatus.CONFIRMED), ReservationStatus.COMPLETED, Requester.admin(99L)))
                    .isInstanceOf(InvalidTransitionException.class);
        }
    }

    @Nested
    @DisplayName("변경 가능 여부")
    class Modifiable {

        @Test
        @DisplayName("시작 1시간 이상 남았으면 변경할 수 있다")
        void modifiableBeforeWindow() {
            clock.setNow(START_AT.minusHours(1));

            assertThatCode(() -> lifecycle.ensureModifiable(reservation(ReservationStatus.CONFIRMED),
                    new BookingRequest(DATE, 11, 2, List.of(5)), Requester.user(OWNER_ID)))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("시작 1시간 이내면 MODIFICATION_WINDOW_CLOSED")
        void closedInsideWindow() {
            clock.setNow(START_AT.minusMinutes(59));

            assertThatThrownBy(() -> lifecycle.ensureModifiable(reservation(ReservationStatus.CONFIRMED),
                    new BookingRequest(DATE, 12, 2, List.of(5)), Requester.user(OWNER_ID)))
                    .isInstanceOf(ModificationWindowClosedException.class);
        }

        @Test
        @DisplayName("새 시작 시각이 1시간 이내면 MODIFICATION_WINDOW_CLOSED")
        void newStartInsideWindow() {
            clock.setNow(LocalDateTime.of(2026, 11, 2, 18, 0));

            assertThatThrownBy(() -> lifecycle.ensureModifiable(reservation(ReservationStatus.CONFIRMED),
                    new BookingRequest(DATE, 8, 2, List.of(5)), Requester.user(OWNER_ID)))
                    .isInstanceOf(ModificationWindowClosedException.class);
        }

        @Test
        @DisplayName("관리자는 시간 제한 없이 변경할 수 있다")
        void adminIgnoresWindow() {
            clock.setNow(START_AT.minusMinutes(5));

            assertThatCode(() -> lifecycle.ensureModifiable(reservation(ReservationStatus.CONFIRMED),
                    new BookingRequest(DATE, 11, 2, List.of(5)), Requester.admin(99L)))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("CONFIRMED 가 아니면 RESERVATION_NOT_MODIFIABLE")
        void onlyConfirmed() {
            assertThatThrownBy(() -> lifecycle.ensureModifiable(reservation(ReservationStatus.SEATED),
                    new BookingRequest(DATE, 11, 2, List.of(5)), Requester.admin(99L)))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                            .isEqualTo(ErrorCode.RESERVATION_NOT_MODIFIABLE));
        }
    }
}
