package kr.jemi.zseat.inventory.application.port.in;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zseat.common.validation.SelfValidating;
import kr.jemi.zseat.inventory.domain.CustomerInfo;

public record CompletePurchaseCommand(
        @NotBlank String sessionId,
        long eventId,
        @NotBlank String orderId,
        @NotNull CustomerInfo customer
) implements SelfValidating {

    public CompletePurchaseCommand(String sessionId, long eventId, String orderId, CustomerInfo customer) {
        this.sessionId = sessionId;
        this.eventId = eventId;
        this.orderId = orderId;
        this.customer = customer;
        validateSelf();
    }
}
