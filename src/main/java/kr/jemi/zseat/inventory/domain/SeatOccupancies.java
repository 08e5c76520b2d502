package kr.jemi.zseat.inventory.domain;

import jakarta.validation.constraints.NotNull;
import kr.jemi.zseat.common.validation.SelfValidating;

import java.util.List;
import java.util.Map;

public class SeatOccupancies implements SelfValidating {

    @NotNull
    private final Map<Long, SeatOccupancy> occupancies;

    public SeatOccupancies(Map<Long, SeatOccupancy> occupancies) {
        this.occupancies = occupancies == null ? null : Map.copyOf(occupancies);
        validateSelf();
    }

    /**
     * 조회하지 않은 좌석은 AVAILABLE로 본다.
     */
    public SeatOccupancy of(long seatId) {
        SeatOccupancy occupancy = occupancies.get(seatId);
        return occupancy == null ? SeatOccupancy.available(seatId) : occupancy;
    }

    public SeatState stateOf(long seatId) {
        return of(seatId).state();
    }

    public List<Long> seatIds() {
        return occupancies.keySet().stream().sorted().toList();
    }
}
