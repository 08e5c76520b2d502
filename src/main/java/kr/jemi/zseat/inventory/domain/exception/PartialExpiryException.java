package kr.jemi.zseat.inventory.domain.exception;

import kr.jemi.zseat.common.exception.ErrorCode;
import kr.jemi.zseat.common.exception.SeatListException;

import java.util.List;

public class PartialExpiryException extends SeatListException {

    public PartialExpiryException(List<Long> expiredSeatIds) {
        super(ErrorCode.PARTIAL_EXPIRY, "선점이 만료된 좌석이 있어 결제를 확정할 수 없습니다: " + expiredSeatIds,
                expiredSeatIds);
    }
}
