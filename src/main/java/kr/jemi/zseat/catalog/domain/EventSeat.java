package kr.jemi.zseat.catalog.domain;

import java.math.BigDecimal;

/**
 * 이벤트 오버라이드가 반영된 좌석.
 */
public record EventSeat(Seat seat, SeatCategory category, BigDecimal price, boolean available) {

    public String categoryName() {
        return category == null ? null : category.name();
    }

    public String categoryColor() {
        return category == null ? null : category.colorCode();
    }
}
