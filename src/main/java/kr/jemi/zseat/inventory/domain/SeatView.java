package kr.jemi.zseat.inventory.domain;

import java.math.BigDecimal;

public record SeatView(PricedSeat seat, SeatState state) {

    public long seatId() {
        return seat.seatId();
    }

    public BigDecimal price() {
        return seat.price();
    }

    public boolean isAvailable() {
        return state == SeatState.AVAILABLE;
    }
}
