package kr.jemi.zseat.catalog.api;

import java.math.BigDecimal;

public record CatalogSeat(
        long seatId,
        long chartId,
        Long categoryId,
        String categoryName,
        String categoryColor,
        String section,
        String rowLabel,
        int seatNumber,
        String label,
        BigDecimal price,
        boolean available,
        boolean accessible,
        boolean premium
) {
}
