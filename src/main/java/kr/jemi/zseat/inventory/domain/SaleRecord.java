package kr.jemi.zseat.inventory.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 저장소에 남은 좌석 판매 기록. 판매 원장에 아직 옮겨지지 않은 판매를 복구할 때 쓴다.
 */
public record SaleRecord(
        long eventId,
        long seatId,
        String orderId,
        String sessionId,
        CustomerInfo customer,
        BigDecimal price,
        Instant finalizedAt
) {
}
