package kr.jemi.zseat.catalog.domain;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zseat.common.validation.SelfValidating;

import java.math.BigDecimal;

/**
 * 배치도에 속한 좌석 템플릿. 삭제하지 않고 active=false로 비활성화한다.
 * 카테고리는 참조가 아니라 ID로만 가진다.
 */
public record Seat(
        long id,
        long chartId,
        Long categoryId,
        String section,
        String rowLabel,
        int seatNumber,
        @NotBlank String label,
        Double x,
        Double y,
        @NotNull @DecimalMin("0.00") BigDecimal basePrice,
        boolean accessible,
        boolean premium,
        boolean active
) implements SelfValidating {

    public Seat(long id, long chartId, Long categoryId, String section, String rowLabel, int seatNumber,
                String label, Double x, Double y, BigDecimal basePrice,
                boolean accessible, boolean premium, boolean active) {
        this.id = id;
        this.chartId = chartId;
        this.categoryId = categoryId;
        this.section = section;
        this.rowLabel = rowLabel;
        this.seatNumber = seatNumber;
        this.label = label;
        this.x = x;
        this.y = y;
        this.basePrice = basePrice;
        this.accessible = accessible;
        this.premium = premium;
        this.active = active;
        validateSelf();
    }
}
