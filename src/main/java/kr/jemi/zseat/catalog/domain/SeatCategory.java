package kr.jemi.zseat.catalog.domain;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zseat.common.validation.SelfValidating;

import java.math.BigDecimal;

public record SeatCategory(
        long id,
        long chartId,
        @NotBlank String name,
        String colorCode,
        @NotNull @DecimalMin("0.00") BigDecimal price,
        @NotNull @DecimalMin(value = "0.00", inclusive = false) BigDecimal priceModifier,
        boolean accessible,
        boolean premium,
        int sortOrder
) implements SelfValidating {

    public static final String DEFAULT_COLOR = "#3B82F6";

    public SeatCategory(long id, long chartId, String name, String colorCode, BigDecimal price,
                        BigDecimal priceModifier, boolean accessible, boolean premium, int sortOrder) {
        this.id = id;
        this.chartId = chartId;
        this.name = name;
        this.colorCode = colorCode == null ? DEFAULT_COLOR : colorCode;
        this.price = price;
        this.priceModifier = priceModifier == null ? BigDecimal.ONE : priceModifier;
        this.accessible = accessible;
        this.premium = premium;
        this.sortOrder = sortOrder;
        validateSelf();
    }
}
