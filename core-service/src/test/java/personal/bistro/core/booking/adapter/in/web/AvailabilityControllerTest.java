package personal.bistro.core.booking.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import personal.bistro.core.booking.application.port.in.GetAvailabilityUseCase;
import personal.bistro.core.booking.application.port.in.GetAvailabilityUseCase.TableAvailability;
import personal.bistro.core.booking.application.port.in.GetAvailabilityUseCase.TableDaySchedule;
import personal.bistro.core.booking.domain.exception.InvalidSlotException;
import personal.bistro.core.table.domain.model.DiningTable;

import java.time.LocalDate;
import java.util.List;
import java.util.TreeSet;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AvailabilityController.class)
@DisplayName("AvailabilityController 테스트")
class AvailabilityControllerTest {

    private static final LocalDate DATE = LocalDate.of(2026, 11, 2);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GetAvailabilityUseCase getAvailabilityUseCase;

    @Test
    @DisplayName("슬롯 목록은 15개이며 점심과 저녁으로 나뉜다")
    void timeSlots() throws Exception {
        mockMvc.perform(get("/api/v1/time-slots"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(15))
                .andExpect(jsonPath("$[0].time").value("11:00"))
                .andExpect(jsonPath("$[0].period").value("LUNCH"))
                .andExpect(jsonPath("$[6].time").value("18:00"))
                .andExpect(jsonPath("$[6].period").value("DINNER"));
    }

    @Test
    @DisplayName("가용 테이블을 세 그룹의 테이블 번호로 반환한다")
    void availability() throws Exception {
        given(getAvailabilityUseCase.findAvailableTables(DATE, 10, 3, null)).willReturn(new TableAvailability(
                List.of(DiningTable.create(2, 4)),
                List.of(DiningTable.create(1, 4)),
                List.of(DiningTable.create(11, 6))));

        mockMvc.perform(get("/api/v1/availability")
                        .param("date", "2026-11-02")
                        .param("slot", "10")
                        .param("guests", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.availableTables[0]").value(2))
                .andExpect(jsonPath("$.occupiedTables[0]").value(1))
                .andExpect(jsonPath("$.notEligibleTables[0]").value(11));
    }

    @Test
    @DisplayName("잘못된 슬롯은 400 INVALID_SLOT")
    void invalidSlot() throws Exception {
        given(getAvailabilityUseCase.findAvailableTables(DATE, 16, 1, null)).willThrow(new InvalidSlotException(16));

        mockMvc.perform(get("/api/v1/availability")
                        .param("date", "2026-11-02")
                        .param("slot", "16"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("R003"));
    }

    @Test
    @DisplayName("날짜 파라미터가 없으면 400")
    void missingDate() throws Exception {
        mockMvc.perform(get("/api/v1/availability").param("slot", "10"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));
    }

    @Test
    @DisplayName("날짜별 테이블 점유 현황")
    void dailyAvailability() throws Exception {
        given(getAvailabilityUseCase.getDailyAvailability(DATE)).willReturn(List.of(
                new TableDaySchedule(1, 4, new TreeSet<>(List.of(10, 11, 12)),
                        new TreeSet<>(List.of(1, 2, 3, 4, 5, 6, 7, 13, 14, 15)), false)));

        mockMvc.perform(get("/api/v1/tables/availability").param("date", "2026-11-02"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].tableNumber").value(1))
                .andExpect(jsonPath("$[0].bookedSlots.length()").value(3))
                .andExpect(jsonPath("$[0].isFullyBooked").value(false));
    }
}
