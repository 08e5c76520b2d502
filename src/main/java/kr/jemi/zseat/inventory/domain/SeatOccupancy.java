package kr.jemi.zseat.inventory.domain;

import jakarta.validation.constraints.NotNull;
import kr.jemi.zseat.common.validation.SelfValidating;

/**
 * 저장소에서 읽은 좌석 점유 상태. HELD는 holdId, SOLD는 orderId를 가진다.
 */
public record SeatOccupancy(long seatId, @NotNull SeatState state, Long holdId, String orderId)
        implements SelfValidating {

    public SeatOccupancy(long seatId, SeatState state, Long holdId, String orderId) {
        this.seatId = seatId;
        this.state = state;
        this.holdId = holdId;
        this.orderId = orderId;
        validate();
    }

    private void validate() {
        validateSelf();
        switch (state) {
            case AVAILABLE -> {
                if (holdId != null || orderId != null) {
                    throw new IllegalArgumentException("AVAILABLE 좌석은 선점/주문 정보가 없어야 합니다");
                }
            }
            case HELD -> {
                if (holdId == null) {
                    throw new IllegalArgumentException("HELD 좌석은 선점 ID가 반드시 있어야 합니다");
                }
            }
            case SOLD -> {
                if (orderId == null || orderId.isBlank()) {
                    throw new IllegalArgumentException("SOLD 좌석은 주문 ID가 반드시 있어야 합니다");
                }
            }
        }
    }

    public static SeatOccupancy available(long seatId) {
        return new SeatOccupancy(seatId, SeatState.AVAILABLE, null, null);
    }

    public static SeatOccupancy held(long seatId, long holdId) {
        return new SeatOccupancy(seatId, SeatState.HELD, holdId, null);
    }

    public static SeatOccupancy sold(long seatId, String orderId) {
        return new SeatOccupancy(seatId, SeatState.SOLD, null, orderId);
    }
}
