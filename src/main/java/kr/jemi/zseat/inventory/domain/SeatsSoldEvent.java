package kr.jemi.zseat.inventory.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record SeatsSoldEvent(
        long eventId,
        String orderId,
        String sessionId,
        List<Line> seats,
        CustomerInfo customer,
        Instant finalizedAt
) {

    public record Line(long seatId, BigDecimal price) {
    }

    public List<Long> seatIds() {
        return seats.stream().map(Line::seatId).toList();
    }
}
