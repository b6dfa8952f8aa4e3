package personal.bistro.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import personal.bistro.common.exception.BusinessException;
import personal.bistro.common.exception.ErrorCode;
import personal.bistro.core.auth.Requester;
import personal.bistro.core.booking.adapter.out.persistence.JpaBookedSlotRepository;
import personal.bistro.core.booking.adapter.out.persistence.JpaReservationRepository;
import personal.bistro.core.booking.application.port.in.CancelReservationUseCase;
import personal.bistro.core.booking.application.port.in.ChangeReservationStatusUseCase;
import personal.bistro.core.booking.application.port.in.CreateReservationCommand;
import personal.bistro.core.booking.application.port.in.CreateReservationUseCase;
import personal.bistro.core.booking.application.port.in.GetAvailabilityUseCase;
import personal.bistro.core.booking.application.port.in.GetReservationUseCase;
import personal.bistro.core.booking.application.port.in.UpdateReservationCommand;
import personal.bistro.core.booking.application.port.in.UpdateReservationUseCase;
import personal.bistro.core.booking.application.port.out.BookingLedger;
import personal.bistro.core.booking.domain.model.Reservation;
import personal.bistro.core.booking.domain.model.ReservationStatus;
import personal.bistro.core.support.RecordingNotificationPort;
import personal.bistro.core.support.TestBookingConfiguration;
import personal.bistro.core.support.TestClock;
import personal.bistro.core.table.adapter.out.persistence.JpaDiningTableRepository;
import personal.bistro.core.table.application.port.in.InitializeTablesUseCase;
import personal.bistro.core.table.application.port.in.UpdateTableUseCase;
import personal.bistro.core.table.application.port.in.UpdateTableUseCase.UpdateTableCommand;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 예약 흐름 통합 테스트
 * H2 + 로컬 잠금 + 기록용 알림 포트로 전체 빈을 띄운다.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestBookingConfiguration.class)
@DisplayName("예약 통합 테스트")
class ReservationIntegrationTest {

    private static final LocalDate DATE = LocalDate.of(2026, 11, 2);
    private static final Long USER_ID = 1L;
    private static final Requester ADMIN = Requester.admin(99L);

    @Autowired
    private CreateReservationUseCase createReservationUseCase;

    @Autowired
    private UpdateReservationUseCase updateReservationUseCase;

    @Autowired
    private CancelReservationUseCase cancelReservationUseCase;

    @Autowired
    private ChangeReservationStatusUseCase changeReservationStatusUseCase;

    @Autowired
    private GetReservationUseCase getReservationUseCase;

    @Autowired
    private GetAvailabilityUseCase getAvailabilityUseCase;

    @Autowired
    private InitializeTablesUseCase initializeTablesUseCase;

    @Autowired
    private UpdateTableUseCase updateTableUseCase;

    @Autowired
    private BookingLedger bookingLedger;

    @Autowired
    private JpaReservationRepository jpaReservationRepository;

    @Autowired
    private JpaBookedSlotRepository jpaBookedSlotRepository;

    @Autowired
    private JpaDiningTableRepository jpaDiningTableRepository;

    @Autowired
    private TestClock clock;

    @Autowired
    private RecordingNotificationPort notifications;

    @BeforeEach
    void setUp() {
        clock.setNow(TestBookingConfiguration.DEFAULT_NOW);
        notifications.clear();
        initializeTablesUseCase.initialize();
    }

    @AfterEach
    void tearDown() {
        jpaReservationRepository.deleteAll();
        jpaBookedSlotRepository.deleteAll();
        jpaDiningTableRepository.deleteAll();
    }

    private Reservation create(int slot, int guests, List<Integer> tables) {
        return createReservationUseCase.create(new CreateReservationCommand(
                USER_ID, DATE, slot, guests, tables, "0101234567", null));
    }

    private static ErrorCode errorCodeOf(Throwable e) {
        return ((BusinessException) e).getErrorCode();
    }

    @Test
    @DisplayName("같은 테이블과 슬롯에 동시에 10건을 요청하면 정확히 1건만 성공한다")
    void concurrentCreationsOnSameTable() throws Exception {
        // given
        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger success = new AtomicInteger();
        List<ErrorCode> failures = new ArrayList<>();
        ConcurrentHashMap<Integer, ErrorCode> failureByThread = new ConcurrentHashMap<>();

        // when
        for (int i = 0; i < threads; i++) {
            int index = i;
            executor.submit(() -> {
                ready.countDown();
                try {
                    start.await();
                    createReservationUseCase.create(new CreateReservationCommand(
                            (long) (index + 1), DATE, 10, 2, List.of(5), "0101234567", null));
                    success.incrementAndGet();
                } catch (BusinessException e) {
                    failureByThread.put(index, e.getErrorCode());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        ready.await(5, TimeUnit.SECONDS);
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
        failures.addAll(failureByThread.values());

        // then
        assertThat(success.get()).isEqualTo(1);
        assertThat(failures).hasSize(threads - 1)
                .allMatch(code -> code == ErrorCode.SLOT_CONFLICT || code == ErrorCode.CONCURRENT_RESERVATION);
        assertThat(bookingLedger.getOccupiedSlots(5, DATE)).containsExactly(10, 11, 12);
        assertThat(jpaReservationRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("겹치는 테이블을 반대 순서로 동시에 요청해도 교착 없이 정확히 1건만 성공한다")
    void concurrentMultiTableRequestsInOppositeOrder() throws Exception {
        // given
        int[] startSlots = {1, 4, 7, 10, 13};
        ExecutorService executor = Executors.newFixedThreadPool(2);

        for (int slot : startSlots) {
            CountDownLatch ready = new CountDownLatch(2);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger success = new AtomicInteger();
            ConcurrentHashMap<Long, ErrorCode> failures = new ConcurrentHashMap<>();
            List<List<Integer>> orders = List.of(List.of(1, 2), List.of(2, 1));
            List<Future<?>> futures = new ArrayList<>();

            // when
            for (int i = 0; i < orders.size(); i++) {
                long userId = i + 1;
                List<Integer> tables = orders.get(i);
                futures.add(executor.submit(() -> {
                    ready.countDown();
                    try {
                        start.await();
                        createReservationUseCase.create(new CreateReservationCommand(
                                userId, DATE, slot, 4, tables, "0101234567", null));
                        success.incrementAndGet();
                    } catch (BusinessException e) {
                        failures.put(userId, e.getErrorCode());
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }));
            }
            ready.await(5, TimeUnit.SECONDS);
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }

            // then
            assertThat(success.get()).as("slot %d", slot).isEqualTo(1);
            assertThat(failures.values()).as("slot %d", slot).hasSize(1)
                    .allMatch(code -> code == ErrorCode.SLOT_CONFLICT || code == ErrorCode.CONCURRENT_RESERVATION);
            assertThat(bookingLedger.getOccupiedSlots(1, DATE))
                    .isEqualTo(bookingLedger.getOccupiedSlots(2, DATE));
        }
        executor.shutdown();

        assertThat(jpaReservationRepository.count()).isEqualTo(startSlots.length);
        assertThat(bookingLedger.getOccupiedSlots(1, DATE)).hasSize(15);
    }

    @Test
    @DisplayName("생성 후 취소하면 점유가 반납되어 같은 조건으로 다시 예약할 수 있다")
    void createCancelRoundTrip() {
        // given
        Reservation created = create(10, 2, List.of(5));
        assertThat(bookingLedger.getOccupiedSlots(5, DATE)).containsExactly(10, 11, 12);

        // when
        Reservation cancelled = cancelReservationUseCase.cancel(created.id(), Requester.user(USER_ID));

        // then
        assertThat(cancelled.status()).isEqualTo(ReservationStatus.CANCELLED);
        assertThat(bookingLedger.getOccupiedSlots(5, DATE)).isEmpty();
        assertThat(create(10, 2, List.of(5)).status()).isEqualTo(ReservationStatus.CONFIRMED);
        assertThat(notifications.events()).contains("created:" + created.id(), "cancelled:" + created.id());
    }

    @Test
    @DisplayName("겹치는 구간은 거절되고 맞닿은 구간은 허용된다")
    void overlappingSpanRejected() {
        create(10, 2, List.of(5));

        assertThatThrownBy(() -> create(11, 2, List.of(5)))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.SLOT_CONFLICT));
        assertThat(create(13, 2, List.of(5)).lastSlot()).isEqualTo(15);
    }

    @Test
    @DisplayName("여러 테이블 중 하나라도 충돌하면 어떤 테이블도 점유하지 않는다")
    void multiTableIsAllOrNothing() {
        // given
        create(10, 2, List.of(3));

        // when & then
        assertThatThrownBy(() -> create(10, 8, List.of(1, 2, 3)))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.SLOT_CONFLICT));
        assertThat(bookingLedger.getOccupiedSlots(1, DATE)).isEmpty();
        assertThat(bookingLedger.getOccupiedSlots(2, DATE)).isEmpty();
        assertThat(jpaReservationRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("테이블 [1, 2] 예약을 [3] 으로 바꾸면 1, 2 는 비고 3 만 점유된다")
    void updateMovesTables() {
        // given
        Reservation created = create(10, 4, List.of(1, 2));

        // when
        Reservation updated = updateReservationUseCase.update(new UpdateReservationCommand(
                created.id(), Requester.user(USER_ID), null, null, null, List.of(3), null, null, null));

        // then
        assertThat(updated.tableNumbers()).containsExactly(3);
        assertThat(updated.reservationNumber()).isEqualTo("20261102-1930-T3");
        assertThat(bookingLedger.getOccupiedSlots(1, DATE)).isEmpty();
        assertThat(bookingLedger.getOccupiedSlots(2, DATE)).isEmpty();
        assertThat(bookingLedger.getOccupiedSlots(3, DATE)).containsExactly(10, 11, 12);
        assertThat(notifications.events()).contains("updated:" + created.id());
    }

    @Test
    @DisplayName("변경 대상이 충돌하면 기존 점유와 예약이 그대로 유지된다")
    void failedUpdateKeepsOriginal() {
        // given
        Reservation created = create(10, 4, List.of(1, 2));
        create(10, 2, List.of(3));

        // when & then
        assertThatThrownBy(() -> updateReservationUseCase.update(new UpdateReservationCommand(
                created.id(), Requester.user(USER_ID), null, null, null, List.of(3), null, null, null)))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.SLOT_CONFLICT));
        assertThat(bookingLedger.getOccupiedSlots(1, DATE)).containsExactly(10, 11, 12);
        assertThat(bookingLedger.getOccupiedSlots(2, DATE)).containsExactly(10, 11, 12);
        assertThat(getReservationUseCase.getReservation(created.id(), ADMIN).tableNumbers()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("노쇼 처리 후 착석으로 바꿀 수 없고 점유는 반납된 상태로 남는다")
    void noShowThenSeated() {
        // given
        Reservation created = create(10, 2, List.of(5));
        clock.setNow(LocalDateTime.of(2026, 11, 2, 19, 45));
        changeReservationStatusUseCase.changeStatus(created.id(), ReservationStatus.NO_SHOW, ADMIN);

        // when & then
        assertThatThrownBy(() -> changeReservationStatusUseCase.changeStatus(
                created.id(), ReservationStatus.SEATED, ADMIN))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.INVALID_TRANSITION));
        assertThat(bookingLedger.getOccupiedSlots(5, DATE)).isEmpty();
        assertThat(getReservationUseCase.getReservation(created.id(), ADMIN).status())
                .isEqualTo(ReservationStatus.NO_SHOW);
    }

    @Test
    @DisplayName("착석 후 완료해도 점유는 유지된다")
    void completedKeepsSlots() {
        Reservation created = create(10, 2, List.of(5));
        clock.setNow(LocalDateTime.of(2026, 11, 2, 19, 30));

        changeReservationStatusUseCase.changeStatus(created.id(), ReservationStatus.SEATED, ADMIN);
        Reservation completed = changeReservationStatusUseCase.changeStatus(
                created.id(), ReservationStatus.COMPLETED, ADMIN);

        assertThat(completed.status()).isEqualTo(ReservationStatus.COMPLETED);
        assertThat(bookingLedger.getOccupiedSlots(5, DATE)).containsExactly(10, 11, 12);
    }

    @Test
    @DisplayName("좌석 합이 인원과 같으면 성공하고 하나 모자라면 CAPACITY_EXCEEDED")
    void capacityBoundary() {
        assertThat(create(10, 8, List.of(1, 2)).guests()).isEqualTo(8);

        assertThatThrownBy(() -> create(1, 9, List.of(1, 2)))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.CAPACITY_EXCEEDED));
        assertThat(bookingLedger.getOccupiedSlots(1, DATE)).containsExactly(10, 11, 12);
    }

    @Test
    @DisplayName("비활성 테이블은 TABLE_INVALID")
    void inactiveTable() {
        updateTableUseCase.updateTable(new UpdateTableCommand(4, null, null, false));

        assertThatThrownBy(() -> create(10, 2, List.of(4)))
                .satisfies(e -> assertThat(errorCodeOf(e)).isEqualTo(ErrorCode.TABLE_INVALID));
        assertThat(getAvailabilityUseCase.findAvailableTables(DATE, 10, 2, null).available())
                .noneMatch(table -> table.tableNumber() == 4);
    }

    @Test
    @DisplayName("다른 날짜의 점유는 서로 영향을 주지 않는다")
    void datesAreIndependent() {
        create(10, 2, List.of(5));

        Reservation nextDay = createReservationUseCase.create(new CreateReservationCommand(
                USER_ID, DATE.plusDays(1), 10, 2, List.of(5), "0101234567", null));

        assertThat(nextDay.status()).isEqualTo(ReservationStatus.CONFIRMED);
        assertThat(bookingLedger.getOccupiedSlots(5, DATE.plusDays(1))).containsExactly(10, 11, 12);
    }

    @Test
    @DisplayName("테이블 초기화는 두 번째 호출에서 아무것도 만들지 않는다")
    void initializeTwice() {
        assertThat(initializeTablesUseCase.initialize()).isZero();
        assertThat(jpaDiningTableRepository.count()).isEqualTo(22);
    }

    @Test
    @DisplayName("통계는 모든 상태를 포함한다")
    void statistics() {
        Reservation first = create(10, 2, List.of(5));
        create(10, 2, List.of(6));
        cancelReservationUseCase.cancel(first.id(), Requester.user(USER_ID));

        GetReservationUseCase.ReservationStatistics statistics = getReservationUseCase.getStatistics();

        assertThat(statistics.total()).isEqualTo(2);
        assertThat(statistics.byStatus())
                .containsEntry(ReservationStatus.CONFIRMED, 1L)
                .containsEntry(ReservationStatus.CANCELLED, 1L)
                .containsEntry(ReservationStatus.NO_SHOW, 0L);
    }
}
