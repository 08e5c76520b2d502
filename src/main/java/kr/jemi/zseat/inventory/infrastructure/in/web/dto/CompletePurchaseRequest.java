package kr.jemi.zseat.inventory.infrastructure.in.web.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record CompletePurchaseRequest(
        @NotBlank String sessionId,
        @NotBlank String orderId,
        @NotBlank @Email String customerEmail,
        @NotBlank String customerName,
        String paymentMethod
) {
}
