package kr.jemi.zseat.common.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {

    INVALID_INPUT(400, "유효하지 않은 요청입니다"),
    CHART_NOT_FOUND(404, "좌석 배치도를 찾을 수 없습니다"),
    SEAT_NOT_FOUND(404, "좌석을 찾을 수 없습니다"),
    SEAT_UNAVAILABLE(409, "선점할 수 없는 좌석이 포함되어 있습니다"),
    INSUFFICIENT_AVAILABILITY(409, "요청한 수량만큼 선택 가능한 좌석이 없습니다"),
    HOLD_NOT_FOUND(404, "좌석 선점 내역을 찾을 수 없습니다"),
    HOLD_EXPIRED(410, "좌석 선점 시간이 만료되었습니다"),
    HOLD_NOT_ACTIVE(409, "연장할 수 없는 선점 상태입니다"),
    PARTIAL_EXPIRY(409, "선점이 만료된 좌석이 있어 결제를 확정할 수 없습니다"),
    INTERNAL_ERROR(500, "내부 서버 오류가 발생했습니다");

    private final HttpStatus status;
    private final String message;

    ErrorCode(int statusCode, String message) {
        this.status = HttpStatus.valueOf(statusCode);
        this.message = message;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }
}
