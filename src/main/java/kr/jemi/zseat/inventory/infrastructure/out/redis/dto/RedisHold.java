package kr.jemi.zseat.inventory.infrastructure.out.redis.dto;

import kr.jemi.zseat.inventory.domain.HoldReason;
import kr.jemi.zseat.inventory.domain.HoldStatus;
import kr.jemi.zseat.inventory.domain.SeatHold;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 선점 해시 필드와 도메인 사이의 변환. 시각은 epoch 밀리초 문자열로 저장한다.
 */
public record RedisHold(Map<String, String> fields) {

    public static RedisHold from(SeatHold hold) {
        return new RedisHold(Map.ofEntries(
                Map.entry("id", String.valueOf(hold.getId())),
                Map.entry("batchId", String.valueOf(hold.getBatchId())),
                Map.entry("seatId", String.valueOf(hold.getSeatId())),
                Map.entry("eventId", String.valueOf(hold.getEventId())),
                Map.entry("sessionId", hold.getSessionId()),
                Map.entry("customerEmail", hold.getCustomerEmail() == null ? "" : hold.getCustomerEmail()),
                Map.entry("heldAt", String.valueOf(hold.getHeldAt().toEpochMilli())),
                Map.entry("expiresAt", String.valueOf(hold.getExpiresAt().toEpochMilli())),
                Map.entry("durationMinutes", String.valueOf(hold.getDurationMinutes())),
                Map.entry("status", hold.getStatus().name()),
                Map.entry("reason", hold.getReason().name()),
                Map.entry("updatedAt", String.valueOf(hold.getHeldAt().toEpochMilli()))
        ));
    }

    public static RedisHold fromHash(Map<Object, Object> hash) {
        Map<String, String> fields = new HashMap<>();
        hash.forEach((key, value) -> fields.put(String.valueOf(key), String.valueOf(value)));
        return new RedisHold(Map.copyOf(fields));
    }

    /**
     * 스크립트 인자로 넘길 필드/값 목록. 필드 이름 순으로 정렬한다.
     */
    public List<String> toArgs() {
        List<String> args = new ArrayList<>();
        fields.keySet().stream().sorted().forEach(field -> {
            args.add(field);
            args.add(fields.get(field));
        });
        return args;
    }

    public SeatHold toDomain() {
        return new SeatHold(
                Long.parseLong(fields.get("id")),
                Long.parseLong(fields.get("batchId")),
                Long.parseLong(fields.get("seatId")),
                Long.parseLong(fields.get("eventId")),
                fields.get("sessionId"),
                fields.get("customerEmail"),
                Instant.ofEpochMilli(Long.parseLong(fields.get("heldAt"))),
                Instant.ofEpochMilli(Long.parseLong(fields.get("expiresAt"))),
                Integer.parseInt(fields.get("durationMinutes")),
                HoldStatus.valueOf(fields.get("status")),
                HoldReason.valueOf(fields.getOrDefault("reason", HoldReason.CHECKOUT.name())),
                fields.get("orderId")
        );
    }
}
