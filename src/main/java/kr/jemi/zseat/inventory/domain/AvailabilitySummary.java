package kr.jemi.zseat.inventory.domain;

import java.math.BigDecimal;
import java.util.List;

public record AvailabilitySummary(int total, int available, int held, int sold, BigDecimal soldValue) {

    public static AvailabilitySummary of(List<SeatView> views) {
        int available = 0;
        int held = 0;
        int sold = 0;
        BigDecimal soldValue = BigDecimal.ZERO.setScale(2);
        for (SeatView view : views) {
            switch (view.state()) {
                case AVAILABLE -> available++;
                case HELD -> held++;
                case SOLD -> {
                    sold++;
                    soldValue = soldValue.add(view.price());
                }
            }
        }
        return new AvailabilitySummary(views.size(), available, held, sold, soldValue);
    }
}
