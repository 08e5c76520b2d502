package kr.jemi.zseat.catalog.domain;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * 이벤트 단위로 배치도 템플릿 위에 덮어쓰는 값. 템플릿 자체는 바꾸지 않는다.
 */
public record EventOverrides(
        long eventId,
        long chartId,
        Map<Long, BigDecimal> seatPrices,
        Map<Long, Boolean> seatAvailability,
        Map<Long, BigDecimal> categoryMultipliers
) {

    public EventOverrides {
        seatPrices = seatPrices == null ? Map.of() : Map.copyOf(seatPrices);
        seatAvailability = seatAvailability == null ? Map.of() : Map.copyOf(seatAvailability);
        categoryMultipliers = categoryMultipliers == null ? Map.of() : Map.copyOf(categoryMultipliers);
    }

    public static EventOverrides none(long eventId, long chartId) {
        return new EventOverrides(eventId, chartId, Map.of(), Map.of(), Map.of());
    }

    public Optional<BigDecimal> priceOf(long seatId) {
        return Optional.ofNullable(seatPrices.get(seatId));
    }

    public Optional<Boolean> availabilityOf(long seatId) {
        return Optional.ofNullable(seatAvailability.get(seatId));
    }

    public Optional<BigDecimal> multiplierOf(Long categoryId) {
        return categoryId == null ? Optional.empty() : Optional.ofNullable(categoryMultipliers.get(categoryId));
    }
}
