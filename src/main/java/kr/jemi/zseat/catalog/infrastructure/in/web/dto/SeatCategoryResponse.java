package kr.jemi.zseat.catalog.infrastructure.in.web.dto;

import kr.jemi.zseat.catalog.domain.SeatCategory;

import java.math.BigDecimal;

public record SeatCategoryResponse(
        long id,
        String name,
        String colorCode,
        BigDecimal price,
        BigDecimal priceModifier,
        boolean accessible,
        boolean premium,
        int sortOrder
) {

    public static SeatCategoryResponse from(SeatCategory category) {
        return new SeatCategoryResponse(
                category.id(),
                category.name(),
                category.colorCode(),
                category.price(),
                category.priceModifier(),
                category.accessible(),
                category.premium(),
                category.sortOrder()
        );
    }
}
