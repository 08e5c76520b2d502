package kr.jemi.zseat.inventory.domain.exception;

import kr.jemi.zseat.common.exception.BusinessException;
import kr.jemi.zseat.common.exception.ErrorCode;

public class HoldNotFoundException extends BusinessException {

    public HoldNotFoundException(long holdId) {
        super(ErrorCode.HOLD_NOT_FOUND, "좌석 선점 내역을 찾을 수 없습니다: holdId=" + holdId);
    }

    public HoldNotFoundException(String sessionId, long eventId) {
        super(ErrorCode.HOLD_NOT_FOUND,
                "결제할 선점이 없습니다: sessionId=" + sessionId + ", eventId=" + eventId);
    }
}
