package kr.jemi.zseat.inventory.domain;

import java.math.BigDecimal;
import java.util.Map;

/**
 * 판매 확정 요청. prices는 좌석 ID별 판매 가격이다.
 */
public record SaleRequest(long eventId, String sessionId, String orderId, CustomerInfo customer,
                          Map<Long, BigDecimal> prices) {

    public SaleRequest {
        prices = Map.copyOf(prices);
    }

    public BigDecimal priceOf(long seatId) {
        return prices.getOrDefault(seatId, BigDecimal.ZERO);
    }
}
