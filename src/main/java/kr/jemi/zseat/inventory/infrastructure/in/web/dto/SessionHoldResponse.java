package kr.jemi.zseat.inventory.infrastructure.in.web.dto;

import kr.jemi.zseat.inventory.domain.SessionHold;

import java.time.Instant;

public record SessionHoldResponse(long holdId, long seatId, String seatLabel, String status, Instant expiresAt,
                                  long minutesRemaining) {

    public static SessionHoldResponse from(SessionHold hold) {
        return new SessionHoldResponse(
                hold.holdId(),
                hold.seatId(),
                hold.seatLabel(),
                hold.status().name(),
                hold.expiresAt(),
                hold.remainingMinutes()
        );
    }
}
