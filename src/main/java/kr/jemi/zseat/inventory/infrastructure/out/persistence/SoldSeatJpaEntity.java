package kr.jemi.zseat.inventory.infrastructure.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import kr.jemi.zseat.inventory.domain.SoldSeat;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "sold_seats",
        indexes = @Index(name = "idx_sold_seats_order_id", columnList = "order_id"),
        uniqueConstraints = @UniqueConstraint(name = "uk_sold_seats_event_seat", columnNames = {"event_id", "seat_id"}))
public class SoldSeatJpaEntity {

    @Id
    private Long id;

    @Column(name = "seat_id", nullable = false)
    private long seatId;

    @Column(name = "event_id", nullable = false)
    private long eventId;

    @Column(name = "order_id", nullable = false)
    private String orderId;

    @Column(name = "customer_email", nullable = false)
    private String customerEmail;

    @Column(name = "customer_name", nullable = false)
    private String customerName;

    @Column(name = "payment_method", length = 50)
    private String paymentMethod;

    @Column(name = "purchase_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "finalized_at", nullable = false)
    private Instant finalizedAt;

    protected SoldSeatJpaEntity() {}

    public static SoldSeatJpaEntity fromDomain(SoldSeat soldSeat) {
        SoldSeatJpaEntity entity = new SoldSeatJpaEntity();
        entity.id = soldSeat.getId();
        entity.seatId = soldSeat.getSeatId();
        entity.eventId = soldSeat.getEventId();
        entity.orderId = soldSeat.getOrderId();
        entity.customerEmail = soldSeat.getCustomerEmail();
        entity.customerName = soldSeat.getCustomerName();
        entity.paymentMethod = soldSeat.getPaymentMethod();
        entity.price = soldSeat.getPrice();
        entity.finalizedAt = soldSeat.getFinalizedAt();
        return entity;
    }

    public SoldSeat toDomain() {
        return new SoldSeat(id, seatId, eventId, orderId, customerEmail, customerName, paymentMethod, price,
                finalizedAt);
    }
}
