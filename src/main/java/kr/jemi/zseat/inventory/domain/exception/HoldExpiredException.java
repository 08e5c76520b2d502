package kr.jemi.zseat.inventory.domain.exception;

import kr.jemi.zseat.common.exception.BusinessException;
import kr.jemi.zseat.common.exception.ErrorCode;

public class HoldExpiredException extends BusinessException {

    public HoldExpiredException(long holdId) {
        super(ErrorCode.HOLD_EXPIRED, "좌석 선점 시간이 만료되었습니다: holdId=" + holdId);
    }
}
