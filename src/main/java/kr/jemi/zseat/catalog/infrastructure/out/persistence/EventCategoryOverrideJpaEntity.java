package kr.jemi.zseat.catalog.infrastructure.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.math.BigDecimal;

@Entity
@Table(name = "event_category_overrides",
        uniqueConstraints = @UniqueConstraint(name = "uk_event_category_overrides",
                columnNames = {"event_id", "category_id"}))
public class EventCategoryOverrideJpaEntity {

    @Id
    private Long id;

    @Column(name = "event_id", nullable = false)
    private long eventId;

    @Column(name = "seating_chart_id", nullable = false)
    private long chartId;

    @Column(name = "category_id", nullable = false)
    private long categoryId;

    @Column(name = "price_multiplier", nullable = false, precision = 5, scale = 2)
    private BigDecimal priceMultiplier;

    protected EventCategoryOverrideJpaEntity() {}

    public EventCategoryOverrideJpaEntity(Long id, long eventId, long chartId, long categoryId,
                                          BigDecimal priceMultiplier) {
        this.id = id;
        this.eventId = eventId;
        this.chartId = chartId;
        this.categoryId = categoryId;
        this.priceMultiplier = priceMultiplier;
    }

    public long getCategoryId() { return categoryId; }
    public BigDecimal getPriceMultiplier() { return priceMultiplier; }
}
