package kr.jemi.zseat.catalog.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 배치도 템플릿과 이벤트 오버라이드를 읽는 시점에 합친다. 어느 쪽도 변경하지 않는다.
 */
public final class EventSeating {

    private EventSeating() {}

    public static List<EventSeat> merge(SeatingChart chart, EventOverrides overrides) {
        if (overrides.chartId() != chart.getId()) {
            throw new IllegalArgumentException(
                    "배치도와 오버라이드가 일치하지 않습니다: chartId=" + chart.getId() + ", overrides=" + overrides.chartId());
        }
        return chart.seats().stream()
                .map(seat -> apply(chart, overrides, seat))
                .toList();
    }

    public static EventSeat apply(SeatingChart chart, EventOverrides overrides, Seat seat) {
        SeatCategory category = chart.category(seat.categoryId()).orElse(null);
        return new EventSeat(
                seat,
                category,
                effectivePrice(seat, category, overrides),
                effectiveAvailability(seat, overrides)
        );
    }

    /**
     * 좌석 가격 오버라이드가 있으면 그 값을, 없으면 기본가에 배수를 곱한다.
     * 배수는 이벤트 카테고리 배수, 카테고리 자체 배수, 1 순으로 찾는다.
     */
    public static BigDecimal effectivePrice(Seat seat, SeatCategory category, EventOverrides overrides) {
        BigDecimal price = overrides.priceOf(seat.id())
                .orElseGet(() -> seat.basePrice().multiply(multiplier(seat, category, overrides)));
        return price.setScale(2, RoundingMode.HALF_UP);
    }

    public static boolean effectiveAvailability(Seat seat, EventOverrides overrides) {
        return overrides.availabilityOf(seat.id()).orElse(seat.active());
    }

    private static BigDecimal multiplier(Seat seat, SeatCategory category, EventOverrides overrides) {
        return overrides.multiplierOf(seat.categoryId())
                .orElseGet(() -> category == null ? BigDecimal.ONE : category.priceModifier());
    }
}
