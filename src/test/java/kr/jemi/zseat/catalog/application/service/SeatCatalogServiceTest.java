package kr.jemi.zseat.catalog.application.service;

import kr.jemi.zseat.catalog.api.CatalogSeat;
import kr.jemi.zseat.catalog.application.port.out.SeatingChartPort;
import kr.jemi.zseat.catalog.domain.EventOverrides;
import kr.jemi.zseat.catalog.domain.Seat;
import kr.jemi.zseat.catalog.domain.SeatCategory;
import kr.jemi.zseat.catalog.domain.SeatingChart;
import kr.jemi.zseat.catalog.domain.exception.SeatNotFoundException;
import kr.jemi.zseat.common.exception.BusinessException;
import kr.jemi.zseat.common.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class SeatCatalogServiceTest {

    private static final long EVENT_ID = 100L;

    @Mock
    private SeatingChartPort seatingChartPort;

    private SeatCatalogService seatCatalogService;

    @BeforeEach
    void setUp() {
        seatCatalogService = new SeatCatalogService(seatingChartPort);
    }

    private static SeatingChart chart(long chartId, long... seatIds) {
        SeatCategory category = new SeatCategory(chartId * 10, chartId, "일반석", null,
                new BigDecimal("50.00"), null, false, false, 0);
        List<Seat> seats = Arrays.stream(seatIds)
                .mapToObj(id -> new Seat(id, chartId, category.id(), "FLOOR", "A", (int) id, "A-" + id,
                        null, null, new BigDecimal("50.00"), false, false, true))
                .toList();
        return new SeatingChart(chartId, 1L, null, "배치도-" + chartId, true, seats, List.of(category));
    }

    @Nested
    @DisplayName("getChart()")
    class GetChart {

        @Test
        @DisplayName("없는 배치도는 CHART_NOT_FOUND로 실패한다")
        void chartNotFound() {
            // given
            given(seatingChartPort.findChart(1L)).willReturn(Optional.empty());

            // when & then
            assertThatThrownBy(() -> seatCatalogService.getChart(1L))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.CHART_NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("findEventSeats() - 좌석 ID로 이벤트 좌석 조회")
    class FindEventSeats {

        @Test
        @DisplayName("여러 배치도에 걸친 좌석도 좌석 ID 순으로 돌려준다")
        void acrossCharts() {
            // given
            given(seatingChartPort.findChartIds(any())).willReturn(Map.of(1L, 1L, 2L, 1L, 7L, 2L));
            given(seatingChartPort.findChart(1L)).willReturn(Optional.of(chart(1L, 1L, 2L)));
            given(seatingChartPort.findChart(2L)).willReturn(Optional.of(chart(2L, 7L)));
            given(seatingChartPort.findOverrides(EVENT_ID, 1L))
                    .willReturn(new EventOverrides(EVENT_ID, 1L, Map.of(2L, new BigDecimal("99")), null, null));
            given(seatingChartPort.findOverrides(EVENT_ID, 2L)).willReturn(EventOverrides.none(EVENT_ID, 2L));

            // when
            List<CatalogSeat> seats = seatCatalogService.findEventSeats(EVENT_ID, List.of(7L, 2L, 1L));

            // then
            assertThat(seats).extracting(CatalogSeat::seatId).containsExactly(1L, 2L, 7L);
            assertThat(seats.get(1).price()).isEqualByComparingTo("99.00");
            assertThat(seats.get(2).chartId()).isEqualTo(2L);
            assertThat(seats.get(0).categoryName()).isEqualTo("일반석");
        }

        @Test
        @DisplayName("하나라도 없는 좌석이 있으면 없는 좌석 ID를 담아 실패한다")
        void missingSeat() {
            // given
            given(seatingChartPort.findChartIds(any())).willReturn(Map.of(1L, 1L));

            // when & then
            assertThatThrownBy(() -> seatCatalogService.findEventSeats(EVENT_ID, List.of(1L, 5L, 3L)))
                    .isInstanceOf(SeatNotFoundException.class)
                    .satisfies(e -> assertThat(((SeatNotFoundException) e).getSeatIds()).containsExactly(3L, 5L));
            then(seatingChartPort).should(never()).findChart(anyLong());
        }
    }

    @Test
    @DisplayName("listEventSeats()는 배치도 전체에 오버라이드를 반영한다")
    void listEventSeats() {
        // given
        given(seatingChartPort.findChart(1L)).willReturn(Optional.of(chart(1L, 1L, 2L)));
        given(seatingChartPort.findOverrides(EVENT_ID, 1L))
                .willReturn(new EventOverrides(EVENT_ID, 1L, null, Map.of(2L, false), null));

        // when
        List<CatalogSeat> seats = seatCatalogService.listEventSeats(EVENT_ID, 1L);

        // then
        assertThat(seats).extracting(CatalogSeat::available).containsExactly(true, false);
    }
}
