package kr.jemi.zseat.inventory.domain.exception;

import kr.jemi.zseat.common.exception.ErrorCode;
import kr.jemi.zseat.common.exception.SeatListException;

import java.util.List;

public class SeatUnavailableException extends SeatListException {

    public SeatUnavailableException(List<Long> seatIds) {
        super(ErrorCode.SEAT_UNAVAILABLE, "선점할 수 없는 좌석: " + seatIds, seatIds);
    }
}
