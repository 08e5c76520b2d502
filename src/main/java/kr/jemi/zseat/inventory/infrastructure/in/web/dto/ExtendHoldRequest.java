package kr.jemi.zseat.inventory.infrastructure.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record ExtendHoldRequest(@NotNull @Positive Integer additionalMinutes) {
}
