package kr.jemi.zseat.inventory.application.port.in;

import kr.jemi.zseat.inventory.domain.SelectionCriteria;

import java.math.BigDecimal;

public record BestSeatsQuery(long eventId, long chartId, SelectionCriteria criteria) {

    public BestSeatsQuery(long eventId, long chartId, int quantity, boolean preferTogether,
                          BigDecimal maxPrice, String section) {
        this(eventId, chartId, new SelectionCriteria(quantity, preferTogether, maxPrice, section));
    }
}
