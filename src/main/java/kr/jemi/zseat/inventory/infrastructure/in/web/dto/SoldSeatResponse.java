package kr.jemi.zseat.inventory.infrastructure.in.web.dto;

import kr.jemi.zseat.inventory.domain.SoldSeat;

import java.math.BigDecimal;
import java.time.Instant;

public record SoldSeatResponse(long seatId, long eventId, String orderId, BigDecimal price, Instant finalizedAt) {

    public static SoldSeatResponse from(SoldSeat soldSeat) {
        return new SoldSeatResponse(
                soldSeat.getSeatId(),
                soldSeat.getEventId(),
                soldSeat.getOrderId(),
                soldSeat.getPrice(),
                soldSeat.getFinalizedAt()
        );
    }
}
