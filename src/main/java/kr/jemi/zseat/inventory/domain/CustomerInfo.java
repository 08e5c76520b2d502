package kr.jemi.zseat.inventory.domain;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import kr.jemi.zseat.common.validation.SelfValidating;

public record CustomerInfo(@NotBlank @Email String email, @NotBlank String name, String paymentMethod)
        implements SelfValidating {

    public CustomerInfo(String email, String name, String paymentMethod) {
        this.email = email;
        this.name = name;
        this.paymentMethod = paymentMethod;
        validateSelf();
    }
}
