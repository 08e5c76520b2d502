package kr.jemi.zseat.inventory.infrastructure.in.web.dto;

import kr.jemi.zseat.inventory.domain.AvailabilitySummary;

import java.math.BigDecimal;

public record AvailabilitySummaryResponse(int totalSeats, int availableSeats, int heldSeats, int soldSeats,
                                          BigDecimal soldValue) {

    public static AvailabilitySummaryResponse from(AvailabilitySummary summary) {
        return new AvailabilitySummaryResponse(
                summary.total(),
                summary.available(),
                summary.held(),
                summary.sold(),
                summary.soldValue()
        );
    }
}
