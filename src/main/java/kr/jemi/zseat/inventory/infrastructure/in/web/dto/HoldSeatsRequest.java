package kr.jemi.zseat.inventory.infrastructure.in.web.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import kr.jemi.zseat.inventory.domain.HoldReason;

import java.util.List;

public record HoldSeatsRequest(
        @NotEmpty List<Long> seatIds,
        @NotBlank String sessionId,
        @Positive Integer durationMinutes,
        @Email String customerEmail,
        HoldReason reason
) {
}
