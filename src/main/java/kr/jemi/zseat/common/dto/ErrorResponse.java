package kr.jemi.zseat.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import kr.jemi.zseat.common.exception.ErrorCode;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(int status, String code, String message, List<Long> seatIds, Integer available) {

    public static ErrorResponse from(ErrorCode errorCode) {
        return of(errorCode, errorCode.getMessage());
    }

    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(
                errorCode.getStatus().value(),
                errorCode.name(),
                message,
                null,
                null
        );
    }

    public ErrorResponse withSeatIds(List<Long> seatIds) {
        return new ErrorResponse(status, code, message, List.copyOf(seatIds), available);
    }

    public ErrorResponse withAvailable(int available) {
        return new ErrorResponse(status, code, message, seatIds, available);
    }
}
