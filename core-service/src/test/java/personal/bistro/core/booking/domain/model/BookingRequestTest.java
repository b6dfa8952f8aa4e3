package personal.bistro.core.booking.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.bistro.common.exception.ErrorCode;
import personal.bistro.core.auth.Requester;
import personal.bistro.core.booking.application.port.in.CreateReservationCommand;
import personal.bistro.core.booking.application.port.in.UpdateReservationCommand;
import personal.bistro.core.booking.domain.exception.TableInvalidException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BookingRequest 테이블 목록 테스트")
class BookingRequestTest {

    private static final LocalDate DATE = LocalDate.of(2026, 11, 2);

    @Test
    @DisplayName("테이블 목록이 null 이면 빈 목록이 된다")
    void nullListBecomesEmpty() {
        assertThat(new BookingRequest(DATE, 7, 2, null).tableNumbers()).isEmpty();
    }

    @Test
    @DisplayName("테이블 번호에 null 이 있으면 TABLE_INVALID")
    void nullTableNumberIsRejected() {
        assertThatThrownBy(() -> new BookingRequest(DATE, 7, 2, Arrays.asList(1, null)))
                .isInstanceOf(TableInvalidException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.TABLE_INVALID);
    }

    @Test
    @DisplayName("생성 커맨드도 null 테이블 번호를 TABLE_INVALID 로 거부한다")
    void createCommandRejectsNullTableNumber() {
        assertThatThrownBy(() -> new CreateReservationCommand(1L, DATE, 7, 2,
                Arrays.asList(null, 2), "0101234567", null))
                .isInstanceOf(TableInvalidException.class);
    }

    @Test
    @DisplayName("변경 커맨드는 테이블 목록 생략을 허용하고 null 원소는 거부한다")
    void updateCommandTableNumbers() {
        Requester user = Requester.user(1L);

        assertThat(new UpdateReservationCommand(10L, user, null, 8, null, null, null, null, null)
                .tableNumbers()).isNull();
        assertThatThrownBy(() -> new UpdateReservationCommand(10L, user, null, null, null,
                Arrays.asList((Integer) null), null, null, null))
                .isInstanceOf(TableInvalidException.class);
    }

    @Test
    @DisplayName("테이블 목록은 방어적으로 복사된다")
    void tableNumbersAreCopied() {
        List<Integer> tables = new ArrayList<>(List.of(3, 1));
        BookingRequest request = new BookingRequest(DATE, 7, 2, tables);

        tables.add(5);

        assertThat(request.tableNumbers()).containsExactly(3, 1);
    }
}
