package kr.jemi.zseat.catalog.infrastructure.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import kr.jemi.zseat.catalog.domain.Seat;

import java.math.BigDecimal;

@Entity
@Table(name = "seats",
        indexes = @Index(name = "idx_seats_chart_id", columnList = "seating_chart_id"),
        uniqueConstraints = @UniqueConstraint(name = "uk_seats_chart_identifier",
                columnNames = {"seating_chart_id", "seat_identifier"}))
public class SeatJpaEntity {

    @Id
    private Long id;

    @Column(name = "seating_chart_id", nullable = false)
    private long chartId;

    @Column(name = "seat_category_id")
    private Long categoryId;

    @Column(length = 50)
    private String section;

    @Column(name = "row_label", length = 10)
    private String rowLabel;

    @Column(name = "seat_number", nullable = false)
    private int seatNumber;

    @Column(name = "seat_identifier", nullable = false, length = 100)
    private String label;

    @Column(name = "x_position")
    private Double x;

    @Column(name = "y_position")
    private Double y;

    @Column(name = "base_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal basePrice;

    @Column(name = "is_accessible", nullable = false)
    private boolean accessible;

    @Column(name = "is_premium", nullable = false)
    private boolean premium;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    protected SeatJpaEntity() {}

    public SeatJpaEntity(Long id, long chartId, Long categoryId, String section, String rowLabel,
                         int seatNumber, String label, BigDecimal basePrice, boolean active) {
        this.id = id;
        this.chartId = chartId;
        this.categoryId = categoryId;
        this.section = section;
        this.rowLabel = rowLabel;
        this.seatNumber = seatNumber;
        this.label = label;
        this.basePrice = basePrice;
        this.active = active;
    }

    public Seat toDomain() {
        return new Seat(id, chartId, categoryId, section, rowLabel, seatNumber, label, x, y, basePrice,
                accessible, premium, active);
    }

    public Long getId() { return id; }
    public long getChartId() { return chartId; }
}
