package kr.jemi.zseat.catalog.infrastructure.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import kr.jemi.zseat.catalog.domain.SeatCategory;

import java.math.BigDecimal;

@Entity
@Table(name = "seat_categories",
        uniqueConstraints = @UniqueConstraint(name = "uk_seat_categories_chart_name",
                columnNames = {"seating_chart_id", "name"}))
public class SeatCategoryJpaEntity {

    @Id
    private Long id;

    @Column(name = "seating_chart_id", nullable = false)
    private long chartId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "color_code", length = 7)
    private String colorCode;

    @Column(name = "base_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "price_modifier", nullable = false, precision = 5, scale = 2)
    private BigDecimal priceModifier;

    @Column(name = "is_accessible", nullable = false)
    private boolean accessible;

    @Column(name = "is_premium", nullable = false)
    private boolean premium;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    protected SeatCategoryJpaEntity() {}

    public SeatCategoryJpaEntity(Long id, long chartId, String name, String colorCode, BigDecimal price,
                                 BigDecimal priceModifier, boolean accessible, boolean premium, int sortOrder) {
        this.id = id;
        this.chartId = chartId;
        this.name = name;
        this.colorCode = colorCode;
        this.price = price;
        this.priceModifier = priceModifier;
        this.accessible = accessible;
        this.premium = premium;
        this.sortOrder = sortOrder;
    }

    public SeatCategory toDomain() {
        return new SeatCategory(id, chartId, name, colorCode, price, priceModifier, accessible, premium, sortOrder);
    }
}
