package kr.jemi.zseat.catalog.domain.exception;

import kr.jemi.zseat.common.exception.BusinessException;
import kr.jemi.zseat.common.exception.ErrorCode;

public class ChartNotFoundException extends BusinessException {

    public ChartNotFoundException(long chartId) {
        super(ErrorCode.CHART_NOT_FOUND, "좌석 배치도를 찾을 수 없습니다: chartId=" + chartId);
    }
}
