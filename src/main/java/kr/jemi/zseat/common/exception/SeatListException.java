package kr.jemi.zseat.common.exception;

import java.util.List;

/**
 * 특정 좌석 목록 때문에 실패한 요청. 응답 본문에 좌석 ID 목록이 함께 실린다.
 */
public abstract class SeatListException extends BusinessException {

    private final List<Long> seatIds;

    protected SeatListException(ErrorCode errorCode, String message, List<Long> seatIds) {
        super(errorCode, message);
        this.seatIds = List.copyOf(seatIds);
    }

    public List<Long> getSeatIds() {
        return seatIds;
    }
}
