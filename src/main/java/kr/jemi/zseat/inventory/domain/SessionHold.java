package kr.jemi.zseat.inventory.domain;

import java.time.Instant;

public record SessionHold(long holdId, long seatId, String seatLabel, HoldStatus status,
                          Instant expiresAt, long remainingMinutes) {
}
