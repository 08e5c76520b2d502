package kr.jemi.zseat.catalog.domain.exception;

import kr.jemi.zseat.common.exception.ErrorCode;
import kr.jemi.zseat.common.exception.SeatListException;

import java.util.List;

public class SeatNotFoundException extends SeatListException {

    public SeatNotFoundException(List<Long> seatIds) {
        super(ErrorCode.SEAT_NOT_FOUND, "좌석을 찾을 수 없습니다: " + seatIds, seatIds);
    }
}
