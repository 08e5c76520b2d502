package kr.jemi.zseat.inventory.domain;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import kr.jemi.zseat.common.validation.SelfValidating;

import java.math.BigDecimal;

/**
 * 최적 좌석 선택 조건. maxPrice와 section은 null이면 적용하지 않는다.
 */
public record SelectionCriteria(@Positive int quantity, boolean preferTogether,
                                @DecimalMin("0.00") BigDecimal maxPrice, String section)
        implements SelfValidating {

    public SelectionCriteria(int quantity, boolean preferTogether, BigDecimal maxPrice, String section) {
        this.quantity = quantity;
        this.preferTogether = preferTogether;
        this.maxPrice = maxPrice;
        this.section = section == null || section.isBlank() ? null : section;
        validateSelf();
    }

    public boolean accepts(SeatView view) {
        if (!view.isAvailable()) {
            return false;
        }
        if (maxPrice != null && view.price().compareTo(maxPrice) > 0) {
            return false;
        }
        return section == null || section.equals(view.seat().section());
    }
}
