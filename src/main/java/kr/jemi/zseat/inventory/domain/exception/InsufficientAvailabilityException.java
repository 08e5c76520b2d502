package kr.jemi.zseat.inventory.domain.exception;

import kr.jemi.zseat.common.exception.ErrorCode;
import kr.jemi.zseat.common.exception.ShortageException;

public class InsufficientAvailabilityException extends ShortageException {

    public InsufficientAvailabilityException(int requested, int available) {
        super(ErrorCode.INSUFFICIENT_AVAILABILITY,
                "선택 가능한 좌석이 부족합니다: 요청=" + requested + ", 가능=" + available, available);
    }
}
