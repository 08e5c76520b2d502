package kr.jemi.zseat.inventory.application.port.in;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import kr.jemi.zseat.common.validation.SelfValidating;
import kr.jemi.zseat.inventory.domain.HoldReason;

import java.util.List;

/**
 * durationMinutes가 null이면 기본 선점 시간을 쓴다.
 */
public record HoldSeatsCommand(
        @NotEmpty List<@NotNull Long> seatIds,
        long eventId,
        @NotBlank String sessionId,
        @Positive Integer durationMinutes,
        @Email String customerEmail,
        @NotNull HoldReason reason
) implements SelfValidating {

    public HoldSeatsCommand(List<Long> seatIds, long eventId, String sessionId, Integer durationMinutes,
                            String customerEmail, HoldReason reason) {
        this.seatIds = seatIds == null ? null : seatIds.stream().distinct().toList();
        this.eventId = eventId;
        this.sessionId = sessionId;
        this.durationMinutes = durationMinutes;
        this.customerEmail = customerEmail;
        this.reason = reason == null ? HoldReason.CHECKOUT : reason;
        validateSelf();
    }

    public HoldSeatsCommand(List<Long> seatIds, long eventId, String sessionId) {
        this(seatIds, eventId, sessionId, null, null, HoldReason.CHECKOUT);
    }
}
