package kr.jemi.zseat.inventory.domain;

import java.math.BigDecimal;

/**
 * 이벤트 가격과 판매 가능 여부가 반영된 좌석 정보.
 */
public record PricedSeat(
        long seatId,
        long chartId,
        String section,
        String rowLabel,
        int seatNumber,
        String label,
        String categoryName,
        String categoryColor,
        BigDecimal price,
        boolean sellable
) {
}
