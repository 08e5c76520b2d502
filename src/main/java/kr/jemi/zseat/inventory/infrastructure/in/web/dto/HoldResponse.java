package kr.jemi.zseat.inventory.infrastructure.in.web.dto;

import kr.jemi.zseat.inventory.domain.SeatHold;

import java.time.Instant;

public record HoldResponse(long holdId, long seatId, long eventId, String status, Instant heldAt,
                           Instant expiresAt, int durationMinutes) {

    public static HoldResponse from(SeatHold hold) {
        return new HoldResponse(
                hold.getId(),
                hold.getSeatId(),
                hold.getEventId(),
                hold.getStatus().name(),
                hold.getHeldAt(),
                hold.getExpiresAt(),
                hold.getDurationMinutes()
        );
    }
}
