package kr.jemi.zseat.inventory.domain;

import java.util.List;

/**
 * 판매 확정 결과. sold가 false이면 seatIds는 만료되어 판매하지 못한 좌석이다.
 */
public record SaleOutcome(boolean sold, List<Long> seatIds) {

    public SaleOutcome {
        seatIds = seatIds.stream().sorted().toList();
    }

    public static SaleOutcome sold(List<Long> seatIds) {
        return new SaleOutcome(true, seatIds);
    }

    public static SaleOutcome expired(List<Long> seatIds) {
        return new SaleOutcome(false, seatIds);
    }
}
