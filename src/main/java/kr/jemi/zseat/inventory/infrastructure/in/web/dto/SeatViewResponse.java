package kr.jemi.zseat.inventory.infrastructure.in.web.dto;

import kr.jemi.zseat.inventory.domain.PricedSeat;
import kr.jemi.zseat.inventory.domain.SeatView;

import java.math.BigDecimal;

public record SeatViewResponse(
        long seatId,
        String label,
        String section,
        String row,
        int seatNumber,
        String category,
        String color,
        BigDecimal price,
        String status
) {

    public static SeatViewResponse from(SeatView view) {
        PricedSeat seat = view.seat();
        return new SeatViewResponse(
                seat.seatId(),
                seat.label(),
                seat.section(),
                seat.rowLabel(),
                seat.seatNumber(),
                seat.categoryName(),
                seat.categoryColor(),
                seat.price(),
                view.state().name().toLowerCase()
        );
    }
}
