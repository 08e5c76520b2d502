package kr.jemi.zseat.inventory.domain;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zseat.common.validation.SelfValidating;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 판매 확정된 좌석의 원장 기록. 한 번 기록되면 바뀌지 않는다.
 */
public class SoldSeat implements SelfValidating {

    private final long id;
    private final long seatId;
    private final long eventId;
    @NotBlank
    private final String orderId;
    @NotBlank
    private final String customerEmail;
    @NotBlank
    private final String customerName;
    private final String paymentMethod;
    @NotNull
    @DecimalMin("0.00")
    private final BigDecimal price;
    @NotNull
    private final Instant finalizedAt;

    public SoldSeat(long id, long seatId, long eventId, String orderId, String customerEmail, String customerName,
                    String paymentMethod, BigDecimal price, Instant finalizedAt) {
        this.id = id;
        this.seatId = seatId;
        this.eventId = eventId;
        this.orderId = orderId;
        this.customerEmail = customerEmail;
        this.customerName = customerName;
        this.paymentMethod = paymentMethod;
        this.price = price;
        this.finalizedAt = finalizedAt;
        validateSelf();
    }

    public long getId() {
        return id;
    }

    public long getSeatId() {
        return seatId;
    }

    public long getEventId() {
        return eventId;
    }

    public String getOrderId() {
        return orderId;
    }

    public String getCustomerEmail() {
        return customerEmail;
    }

    public String getCustomerName() {
        return customerName;
    }

    public String getPaymentMethod() {
        return paymentMethod;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public Instant getFinalizedAt() {
        return finalizedAt;
    }
}
