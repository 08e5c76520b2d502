package kr.jemi.zseat.catalog.infrastructure.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.math.BigDecimal;

/**
 * 이벤트별 좌석 가격/판매 가능 여부. 값이 null인 항목은 템플릿을 그대로 따른다.
 */
@Entity
@Table(name = "event_seat_overrides",
        uniqueConstraints = @UniqueConstraint(name = "uk_event_seat_overrides",
                columnNames = {"event_id", "seat_id"}))
public class EventSeatOverrideJpaEntity {

    @Id
    private Long id;

    @Column(name = "event_id", nullable = false)
    private long eventId;

    @Column(name = "seating_chart_id", nullable = false)
    private long chartId;

    @Column(name = "seat_id", nullable = false)
    private long seatId;

    @Column(name = "price_override", precision = 10, scale = 2)
    private BigDecimal priceOverride;

    @Column(name = "is_available")
    private Boolean available;

    protected EventSeatOverrideJpaEntity() {}

    public EventSeatOverrideJpaEntity(Long id, long eventId, long chartId, long seatId,
                                      BigDecimal priceOverride, Boolean available) {
        this.id = id;
        this.eventId = eventId;
        this.chartId = chartId;
        this.seatId = seatId;
        this.priceOverride = priceOverride;
        this.available = available;
    }

    public long getSeatId() { return seatId; }
    public BigDecimal getPriceOverride() { return priceOverride; }
    public Boolean getAvailable() { return available; }
}
