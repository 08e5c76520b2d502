package kr.jemi.zseat.inventory.domain.exception;

import kr.jemi.zseat.common.exception.BusinessException;
import kr.jemi.zseat.common.exception.ErrorCode;
import kr.jemi.zseat.inventory.domain.HoldStatus;

public class HoldNotActiveException extends BusinessException {

    public HoldNotActiveException(long holdId, HoldStatus status) {
        super(ErrorCode.HOLD_NOT_ACTIVE, "ACTIVE 상태의 선점만 연장할 수 있습니다: holdId=" + holdId + ", 현재=" + status);
    }
}
