package kr.jemi.zseat.inventory.infrastructure.out.redis.dto;

import kr.jemi.zseat.inventory.domain.CustomerInfo;
import kr.jemi.zseat.inventory.domain.SaleRecord;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 판매 확정 스크립트가 남기는 판매 해시. 빈 결제 수단은 없음으로 읽는다.
 */
public record RedisSale(Map<String, String> fields) {

    public static RedisSale fromHash(Map<Object, Object> hash) {
        Map<String, String> fields = new HashMap<>();
        hash.forEach((key, value) -> fields.put(String.valueOf(key), String.valueOf(value)));
        return new RedisSale(Map.copyOf(fields));
    }

    public SaleRecord toDomain() {
        String paymentMethod = fields.getOrDefault("paymentMethod", "");
        return new SaleRecord(
                Long.parseLong(fields.get("eventId")),
                Long.parseLong(fields.get("seatId")),
                fields.get("orderId"),
                fields.get("sessionId"),
                new CustomerInfo(fields.get("customerEmail"), fields.get("customerName"),
                        paymentMethod.isEmpty() ? null : paymentMethod),
                new BigDecimal(fields.get("price")),
                Instant.ofEpochMilli(Long.parseLong(fields.get("finalizedAt")))
        );
    }
}
